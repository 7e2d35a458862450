// file: core/src/main/java/io/strata/core/conflict/ConflictMarkers.java
package io.strata.core.conflict;

import java.util.ArrayList;
import java.util.List;

/**
 * Textual conflict format shown to the person resolving a merge.
 * <p>
 * Each unresolved region is written as:
 * <pre>
 * &lt;&lt;&lt;&lt;&lt;&lt;&lt; {lower layer label}
 * {ours lines}
 * =======
 * {theirs lines}
 * &gt;&gt;&gt;&gt;&gt;&gt;&gt; {higher layer label}
 * </pre>
 * Regions appear in their original line order, surrounded by the cleanly merged text.
 * The format is consumed by editors and people, so it must stay bit-exact.
 */
public final class ConflictMarkers {

    public static final String START = "<<<<<<<";
    public static final String SEPARATOR = "=======";
    public static final String END = ">>>>>>>";

    private ConflictMarkers() {
        // utility
    }

    /** A region recovered from marked-up text. Line numbers are 1-based and inclusive. */
    public record MarkedRegion(
            String oursLabel,
            List<String> ours,
            String theirsLabel,
            List<String> theirs,
            int startLine,
            int endLine
    ) {
        public MarkedRegion {
            ours = List.copyOf(ours);
            theirs = List.copyOf(theirs);
        }
    }

    /** Marker block for one region, one list element per output line. */
    public static List<String> block(List<String> ours, List<String> theirs, String oursLabel, String theirsLabel) {
        var lines = new ArrayList<String>(ours.size() + theirs.size() + 3);
        lines.add(START + " " + oursLabel);
        lines.addAll(ours);
        lines.add(SEPARATOR);
        lines.addAll(theirs);
        lines.add(END + " " + theirsLabel);
        return lines;
    }

    /** Marker block for one region as text, without a trailing newline. */
    public static String render(String ours, String theirs, String oursLabel, String theirsLabel) {
        return String.join("\n", block(lines(ours), lines(theirs), oursLabel, theirsLabel));
    }

    /** True if {@code text} still contains at least one complete marker block. */
    public static boolean hasMarkers(String text) {
        try {
            return !parse(text).isEmpty();
        } catch (IllegalArgumentException malformed) {
            // a dangling marker is still an unresolved edit
            return true;
        }
    }

    /**
     * Recover every marker block from {@code text}.
     *
     * @throws IllegalArgumentException if a block is opened but not properly closed
     */
    public static List<MarkedRegion> parse(String text) {
        String[] lines = text.split("\n", -1);
        var regions = new ArrayList<MarkedRegion>();
        int i = 0;
        while (i < lines.length) {
            if (!isStart(lines[i])) {
                i++;
                continue;
            }
            int start = i;
            String oursLabel = label(lines[i], START);

            int sep = indexOf(lines, start + 1, SEPARATOR, true);
            if (sep < 0) throw new IllegalArgumentException("Missing separator for conflict opened at line " + (start + 1));
            int end = indexOf(lines, sep + 1, END, false);
            if (end < 0) throw new IllegalArgumentException("Missing end marker for conflict opened at line " + (start + 1));

            regions.add(new MarkedRegion(
                    oursLabel,
                    List.of(lines).subList(start + 1, sep),
                    label(lines[end], END),
                    List.of(lines).subList(sep + 1, end),
                    start + 1,
                    end + 1));
            i = end + 1;
        }
        return regions;
    }

    static List<String> lines(String text) {
        return List.of(text.split("\n", -1));
    }

    private static boolean isStart(String line) {
        return line.equals(START) || line.startsWith(START + " ");
    }

    private static int indexOf(String[] lines, int from, String marker, boolean exact) {
        for (int i = from; i < lines.length; i++) {
            if (isStart(lines[i])) return -1; // nested opening means the previous block is broken
            if (exact ? lines[i].equals(marker) : (lines[i].equals(marker) || lines[i].startsWith(marker + " "))) {
                return i;
            }
        }
        return -1;
    }

    private static String label(String markerLine, String marker) {
        return markerLine.length() > marker.length() ? markerLine.substring(marker.length() + 1) : "";
    }
}
