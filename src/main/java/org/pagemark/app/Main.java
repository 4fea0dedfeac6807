package org.pagemark.app;

import org.pagemark.cfi.Cfi;
import org.pagemark.cfi.CfiParseException;
import org.pagemark.cfi.CfiParser;
import org.pagemark.cfi.CfiPolicy;
import org.pagemark.cfi.CfiResolutionException;
import org.pagemark.cfi.CfiResolver;

/**
 * Minimal command-line entry point used for local smoke runs.
 *
 * <p>Prints the canonical form and zero-based section of each argument. Pass {@code --epub}
 * first to read section references the package-document way.</p>
 */
public class Main {
    private static final String EPUB_FLAG = "--epub";

    /**
     * Parses every argument as a CFI.
     *
     * @param args optional {@code --epub} followed by CFI strings.
     */
    public static void main(String[] args) {
        int first = 0;
        CfiPolicy policy = CfiPolicy.defaults();
        if (args.length > 0 && EPUB_FLAG.equals(args[0])) {
            policy = CfiPolicy.epub();
            first = 1;
        }
        CfiResolver resolver = new CfiResolver(policy);
        for (int i = first; i < args.length; i++) {
            System.out.println(describe(resolver, args[i]));
        }
    }

    static String describe(CfiResolver resolver, String text) {
        try {
            Cfi cfi = CfiParser.parse(text);
            return String.format(
                    "%s -> %s (section %d%s)",
                    text,
                    cfi,
                    resolver.sectionIndex(cfi),
                    cfi.isRange() ? ", range" : ""
            );
        } catch (CfiParseException | CfiResolutionException ex) {
            return text + " -> error: " + ex.getMessage();
        }
    }
}
