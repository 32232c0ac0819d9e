package org.example.ednascan.util;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class Filenames {

    private Filenames() {
    }

    /**
     * Keeps only the last path segment of a client supplied name and replaces anything outside
     * {@code [A-Za-z0-9._ -]} with an underscore. Returns an empty string for null or blank input.
     */
    public static String sanitize(String name) {
        if (name == null) return "";
        Path last = Paths.get(name.replace('\\', '/')).getFileName();
        String base = (last == null) ? "" : last.toString();
        base = base.replaceAll("[\\r\\n\\t]", "_").trim();
        base = base.replaceAll("[^A-Za-z0-9._ -]", "_");
        if (base.equals(".") || base.equals("..")) return "";
        return base;
    }
}
