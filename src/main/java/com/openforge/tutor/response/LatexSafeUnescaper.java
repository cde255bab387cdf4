package com.openforge.tutor.response;

import java.util.List;

/**
 * Converts literal {@code \n}, {@code \r} and {@code \t} sequences left in
 * model output into real control characters without breaking LaTeX commands
 * whose names start with the same letters ({@code \neq}, {@code \theta},
 * {@code \right}, {@code \text} ...).
 */
public final class LatexSafeUnescaper {

    private static final String PLACEHOLDER = "\u0000LATEX\u0000";

    private static final List<String> LATEX_COMMANDS = List.of(
            "frac", "sqrt", "cbrt",
            "times", "div", "pm", "mp", "cdot",
            "leq", "geq", "neq", "approx", "equiv",
            "sum", "prod", "int", "oint",
            "left", "right",
            "begin", "end",
            "text", "mathbf", "mathrm", "mathit", "mathcal",
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta",
            "iota", "kappa", "lambda", "mu", "nu", "xi", "pi", "rho", "sigma",
            "tau", "upsilon", "phi", "chi", "psi", "omega",
            "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon",
            "Phi", "Psi", "Omega",
            "ldots", "cdots", "vdots", "ddots",
            "infty", "partial", "nabla", "angle"
    );

    private LatexSafeUnescaper() {}

    public static String unescape(String text) {
        if (text == null || text.indexOf('\\') < 0) return text;

        String protectedText = text;
        for (String command : LATEX_COMMANDS) {
            protectedText = protectedText.replace("\\" + command, PLACEHOLDER + command);
        }

        protectedText = protectedText
                .replace("\\n", "\n")
                .replace("\\r", "\r")
                .replace("\\t", "\t");

        return protectedText.replace(PLACEHOLDER, "\\");
    }
}
