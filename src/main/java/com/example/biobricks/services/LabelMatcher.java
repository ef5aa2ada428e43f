package com.example.biobricks.services;

import java.util.*;

/**
 * Permissive mapping from externally supplied keys ("plastic_shreds", "Plastic", "sawdust_kg")
 * onto the registry's labels. A key matches a label when the lowercased label contains the
 * normalized key, or the normalized key contains the label's first word.
 * One key can match several labels; callers update all of them.
 */
public class LabelMatcher {
    private final List<String> labels;

    public LabelMatcher(Collection<String> labels) {
        this.labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static String normalize(String key) {
        return key == null ? "" : key.toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    static String firstToken(String label) {
        String l = label.toLowerCase(Locale.ROOT).trim();
        int sp = indexOfWhitespace(l);
        return sp < 0 ? l : l.substring(0, sp);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) if (Character.isWhitespace(s.charAt(i))) return i;
        return -1;
    }

    public boolean matches(String externalKey, String label) {
        String nk = normalize(externalKey);
        String ll = label.toLowerCase(Locale.ROOT);
        return ll.contains(nk) || nk.contains(firstToken(label));
    }

    /** Labels matched by the key, in registry order. */
    public List<String> match(String externalKey) {
        List<String> out = new ArrayList<>();
        if (externalKey == null) return out;
        for (String label : labels) if (matches(externalKey, label)) out.add(label);
        return out;
    }
}
