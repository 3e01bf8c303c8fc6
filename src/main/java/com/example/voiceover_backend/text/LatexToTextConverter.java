package com.example.voiceover_backend.text;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Renders the LaTeX used in math components as readable text: known macros become Unicode
 * symbols, grouping braces disappear and unknown macros are dropped. Superscripts, subscripts and
 * plain operators are left alone, so {@code x^2 + y^2 = z^2} comes out unchanged.
 */
public final class LatexToTextConverter {

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
            entry("times", "×"), entry("div", "÷"), entry("cdot", "·"), entry("pm", "±"), entry("mp", "∓"),
            entry("le", "≤"), entry("leq", "≤"), entry("ge", "≥"), entry("geq", "≥"),
            entry("ne", "≠"), entry("neq", "≠"), entry("approx", "≈"), entry("equiv", "≡"), entry("sim", "~"),
            entry("propto", "∝"), entry("lt", "<"), entry("gt", ">"),
            entry("infty", "∞"), entry("to", "→"), entry("rightarrow", "→"), entry("leftarrow", "←"),
            entry("Rightarrow", "⇒"), entry("Leftarrow", "⇐"), entry("leftrightarrow", "↔"),
            entry("circ", "∘"), entry("degree", "°"), entry("angle", "∠"), entry("perp", "⊥"), entry("parallel", "∥"),
            entry("sum", "∑"), entry("prod", "∏"), entry("int", "∫"), entry("partial", "∂"), entry("nabla", "∇"),
            entry("ldots", "…"), entry("cdots", "⋯"), entry("dots", "…"),
            entry("in", "∈"), entry("notin", "∉"), entry("subset", "⊂"), entry("subseteq", "⊆"),
            entry("cup", "∪"), entry("cap", "∩"), entry("emptyset", "∅"),
            entry("forall", "∀"), entry("exists", "∃"), entry("neg", "¬"), entry("percent", "%"),
            entry("alpha", "α"), entry("beta", "β"), entry("gamma", "γ"), entry("delta", "δ"),
            entry("epsilon", "ε"), entry("varepsilon", "ε"), entry("zeta", "ζ"), entry("eta", "η"),
            entry("theta", "θ"), entry("iota", "ι"), entry("kappa", "κ"), entry("lambda", "λ"),
            entry("mu", "μ"), entry("nu", "ν"), entry("xi", "ξ"), entry("pi", "π"), entry("rho", "ρ"),
            entry("sigma", "σ"), entry("tau", "τ"), entry("upsilon", "υ"), entry("phi", "φ"),
            entry("varphi", "φ"), entry("chi", "χ"), entry("psi", "ψ"), entry("omega", "ω"),
            entry("Gamma", "Γ"), entry("Delta", "Δ"), entry("Theta", "Θ"), entry("Lambda", "Λ"),
            entry("Xi", "Ξ"), entry("Pi", "Π"), entry("Sigma", "Σ"), entry("Phi", "Φ"),
            entry("Psi", "Ψ"), entry("Omega", "Ω"),
            entry("quad", " "), entry("qquad", " ")
    );

    private static final Set<String> FUNCTION_NAMES = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc", "log", "ln", "exp", "lim", "max", "min", "gcd", "det");

    // One argument, rendered as its content.
    private static final Set<String> TEXT_WRAPPERS = Set.of(
            "text", "textrm", "textbf", "textit", "emph", "mbox", "operatorname",
            "mathrm", "mathbf", "mathit", "mathsf", "mathtt", "mathbb", "mathcal", "boldsymbol");

    private static final Set<String> IGNORED = Set.of(
            "left", "right", "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr",
            "displaystyle", "textstyle", "scriptstyle", "limits", "nolimits");

    // Groups deeper than this are flattened and their macros dropped; keeps recursion bounded.
    static final int MAX_NESTING = 64;

    private final String source;
    private int pos;
    private int depth;

    private LatexToTextConverter(String source) {
        this.source = source;
    }

    public static String toText(String latex) {
        if (latex == null || latex.isEmpty()) return "";
        LatexToTextConverter converter = new LatexToTextConverter(latex);
        StringBuilder out = new StringBuilder();
        while (converter.pos < latex.length()) {
            converter.readSequence(out);
            // stray closing brace at top level
            if (converter.pos < latex.length()) converter.pos++;
        }
        return out.toString().strip();
    }

    /** Reads until the end of input or an unmatched closing brace, which is left unread. */
    private void readSequence(StringBuilder out) {
        depth++;
        int flattened = 0;
        try {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '}') {
                    if (flattened == 0) return;
                    flattened--;
                    pos++;
                } else if (c == '{') {
                    pos++;
                    if (depth >= MAX_NESTING) {
                        flattened++;
                    } else {
                        readSequence(out);
                        if (pos < source.length()) pos++; // '}'
                    }
                } else {
                    readToken(c, out);
                }
            }
        } finally {
            depth--;
        }
    }

    private void readToken(char c, StringBuilder out) {
        if (c == '\\') {
            readMacro(out);
        } else if (c == '%') {
            skipComment();
        } else if (c == '~') {
            out.append(' ');
            pos++;
        } else {
            out.append(c);
            pos++;
        }
    }

    private void readMacro(StringBuilder out) {
        pos++; // '\'
        if (pos >= source.length()) return;
        char first = source.charAt(pos);
        if (!Character.isLetter(first)) {
            pos++;
            switch (first) {
                case ',', ';', ':', ' ' -> out.append(' ');
                case '\\' -> out.append(' ');
                case '!' -> { }
                default -> out.append(first); // \{ \} \% \$ \& \_ \#
            }
            return;
        }
        int start = pos;
        while (pos < source.length() && Character.isLetter(source.charAt(pos))) pos++;
        String name = source.substring(start, pos);

        if (depth >= MAX_NESTING && takesArgument(name)) return;
        if (name.equals("frac") || name.equals("dfrac") || name.equals("tfrac")) {
            String numerator = readArgument();
            String denominator = readArgument();
            out.append(parenthesize(numerator)).append('/').append(parenthesize(denominator));
        } else if (name.equals("sqrt")) {
            String index = readOptionalArgument();
            String radicand = readArgument();
            out.append(rootSymbol(index)).append('(').append(radicand).append(')');
        } else if (TEXT_WRAPPERS.contains(name)) {
            out.append(readArgument());
        } else if (IGNORED.contains(name)) {
            if ((name.equals("left") || name.equals("right")) && pos < source.length() && source.charAt(pos) == '.') {
                pos++;
            }
        } else if (SYMBOLS.containsKey(name)) {
            out.append(SYMBOLS.get(name));
        } else if (FUNCTION_NAMES.contains(name)) {
            out.append(name);
        }
        // anything else is dropped; a following group is still read as plain content
    }

    private String readArgument() {
        skipSpaces();
        if (pos >= source.length()) return "";
        char c = source.charAt(pos);
        StringBuilder arg = new StringBuilder();
        depth++;
        try {
            if (c == '{') {
                pos++;
                readSequence(arg);
                if (pos < source.length()) pos++;
            } else if (c == '\\') {
                readMacro(arg);
            } else if (c != '}') {
                arg.append(c);
                pos++;
            }
        } finally {
            depth--;
        }
        return arg.toString().strip();
    }

    private static boolean takesArgument(String name) {
        return name.equals("frac") || name.equals("dfrac") || name.equals("tfrac")
                || name.equals("sqrt") || TEXT_WRAPPERS.contains(name);
    }

    private String readOptionalArgument() {
        skipSpaces();
        if (pos >= source.length() || source.charAt(pos) != '[') return null;
        int close = source.indexOf(']', pos);
        if (close < 0) return null;
        String index = toText(source.substring(pos + 1, close));
        pos = close + 1;
        return index;
    }

    private void skipSpaces() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) pos++;
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') pos++;
    }

    private static String parenthesize(String arg) {
        if (arg.isEmpty() || arg.chars().allMatch(ch -> Character.isLetterOrDigit(ch) || ch == '.')) {
            return arg;
        }
        return "(" + arg + ")";
    }

    private static String rootSymbol(String index) {
        if (index == null || index.isBlank() || index.equals("2")) return "√";
        if (index.equals("3")) return "∛";
        if (index.equals("4")) return "∜";
        return index + "√";
    }
}
