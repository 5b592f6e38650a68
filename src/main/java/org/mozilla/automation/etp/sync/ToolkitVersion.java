package org.mozilla.automation.etp.sync;

import java.util.Comparator;

/**
 * Compares Firefox (toolkit) version strings the way <code>versionCompare</code>
 * does in Remote Settings filter expressions.
 * <p>
 * Each dot-separated part is <code>&lt;number&gt;&lt;string&gt;&lt;number&gt;&lt;string&gt;</code>.
 * Missing parts count as zero, and a part without a string (a release) sorts
 * after the same part with one (<code>142.0a1 &lt; 142.0b3 &lt; 142.0</code>).
 */
public final class ToolkitVersion {

    public static final Comparator<String> COMPARATOR = ToolkitVersion::compare;

    private ToolkitVersion() {
    }

    public static int compare(String a, String b) {
        String[] left = a.trim().split("\\.");
        String[] right = b.trim().split("\\.");
        int parts = Math.max(left.length, right.length);
        for (int i = 0; i < parts; i++) {
            Part l = Part.parse(i < left.length ? left[i] : "0");
            Part r = Part.parse(i < right.length ? right[i] : "0");
            int result = l.compareTo(r);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    record Part(long numberA, String stringB, long numberC, String extraD) implements Comparable<Part> {

        static Part parse(String text) {
            int[] pos = { 0 };
            long a = number(text, pos);
            String b = letters(text, pos);
            long c = number(text, pos);
            String d = text.substring(pos[0]);
            return new Part(a, b, c, d);
        }

        private static long number(String text, int[] pos) {
            int start = pos[0];
            while (pos[0] < text.length() && Character.isDigit(text.charAt(pos[0]))) {
                pos[0]++;
            }
            return start == pos[0] ? 0 : Long.parseLong(text.substring(start, pos[0]));
        }

        private static String letters(String text, int[] pos) {
            int start = pos[0];
            while (pos[0] < text.length() && !Character.isDigit(text.charAt(pos[0]))) {
                pos[0]++;
            }
            return text.substring(start, pos[0]);
        }

        @Override
        public int compareTo(Part o) {
            int result = Long.compare(numberA, o.numberA);
            if (result == 0) {
                result = compareStrings(stringB, o.stringB);
            }
            if (result == 0) {
                result = Long.compare(numberC, o.numberC);
            }
            if (result == 0) {
                result = compareStrings(extraD, o.extraD);
            }
            return result;
        }

        // an empty string is greater than any non-empty string
        private static int compareStrings(String x, String y) {
            if (x.isEmpty() || y.isEmpty()) {
                return Boolean.compare(x.isEmpty(), y.isEmpty());
            }
            return x.compareTo(y);
        }
    }
}
