// file: core/src/main/java/io/strata/core/merge/ThreeWayTextMerger.java
package io.strata.core.merge;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import io.strata.core.conflict.ConflictMarkers;
import io.strata.core.conflict.ConflictRegion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Line-based three-way merge.
 * <p>
 * Algorithm:
 *  1) Diff base->ours and base->theirs (Myers, via java-diff-utils) into hunks,
 *     each replacing a base line range [start, end) with new lines.
 *  2) Walk the base, grouping hunks into clusters. Two hunks share a cluster when
 *     their base ranges intersect or they are anchored at the same base line.
 *  3) A cluster touched by one side takes that side's lines. A cluster touched by
 *     both sides is clean if both produce the same lines, otherwise it becomes a
 *     conflict region written with {@link ConflictMarkers}.
 *  4) Base lines outside every cluster are copied unchanged.
 * <p>
 * Lines are split on '\n' only, so the joined output reproduces line endings and
 * the presence or absence of a trailing newline exactly.
 */
public final class ThreeWayTextMerger implements TextMerger {

    /** A replacement of base lines [start, end) by {@code lines}. */
    private record Hunk(int start, int end, List<String> lines) {}

    @Override
    public TextMergeResult merge(String base, String ours, String theirs, String oursLabel, String theirsLabel) {
        if (ours.equals(theirs)) return TextMergeResult.clean(ours);
        if (ours.equals(base)) return TextMergeResult.clean(theirs);
        if (theirs.equals(base)) return TextMergeResult.clean(ours);

        List<String> baseLines = split(base);
        List<Hunk> oursHunks = hunks(baseLines, split(ours));
        List<Hunk> theirsHunks = hunks(baseLines, split(theirs));

        var out = new ArrayList<String>(baseLines.size() + 8);
        var regions = new ArrayList<ConflictRegion>();
        int pos = 0;
        int i = 0;
        int j = 0;

        while (i < oursHunks.size() || j < theirsHunks.size()) {
            var oursCluster = new ArrayList<Hunk>();
            var theirsCluster = new ArrayList<Hunk>();

            boolean takeOurs = j >= theirsHunks.size()
                    || (i < oursHunks.size() && oursHunks.get(i).start() <= theirsHunks.get(j).start());
            Hunk first = takeOurs ? oursHunks.get(i++) : theirsHunks.get(j++);
            (takeOurs ? oursCluster : theirsCluster).add(first);
            int clusterStart = first.start();
            int clusterEnd = first.end();

            boolean grew = true;
            while (grew) {
                grew = false;
                while (i < oursHunks.size() && overlaps(oursHunks.get(i), clusterStart, clusterEnd)) {
                    Hunk h = oursHunks.get(i++);
                    oursCluster.add(h);
                    clusterEnd = Math.max(clusterEnd, h.end());
                    grew = true;
                }
                while (j < theirsHunks.size() && overlaps(theirsHunks.get(j), clusterStart, clusterEnd)) {
                    Hunk h = theirsHunks.get(j++);
                    theirsCluster.add(h);
                    clusterEnd = Math.max(clusterEnd, h.end());
                    grew = true;
                }
            }

            out.addAll(baseLines.subList(pos, clusterStart));

            if (theirsCluster.isEmpty()) {
                out.addAll(apply(baseLines, clusterStart, clusterEnd, oursCluster));
            } else if (oursCluster.isEmpty()) {
                out.addAll(apply(baseLines, clusterStart, clusterEnd, theirsCluster));
            } else {
                List<String> oursSide = apply(baseLines, clusterStart, clusterEnd, oursCluster);
                List<String> theirsSide = apply(baseLines, clusterStart, clusterEnd, theirsCluster);
                if (oursSide.equals(theirsSide)) {
                    out.addAll(oursSide);
                } else {
                    regions.add(new ConflictRegion(
                            String.join("\n", baseLines.subList(clusterStart, clusterEnd)),
                            String.join("\n", oursSide),
                            String.join("\n", theirsSide),
                            oursLabel,
                            theirsLabel,
                            out.size() + 1));
                    out.addAll(ConflictMarkers.block(oursSide, theirsSide, oursLabel, theirsLabel));
                }
            }
            pos = clusterEnd;
        }
        out.addAll(baseLines.subList(pos, baseLines.size()));

        return new TextMergeResult(String.join("\n", out), regions);
    }

    private static boolean overlaps(Hunk h, int clusterStart, int clusterEnd) {
        if (h.start() == clusterStart) return true;
        return h.start() < clusterEnd && clusterStart < h.end();
    }

    private static List<String> apply(List<String> base, int from, int to, List<Hunk> hunks) {
        var lines = new ArrayList<String>();
        int p = from;
        for (Hunk h : hunks) {
            lines.addAll(base.subList(p, h.start()));
            lines.addAll(h.lines());
            p = h.end();
        }
        lines.addAll(base.subList(p, to));
        return lines;
    }

    private static List<Hunk> hunks(List<String> base, List<String> revised) {
        Patch<String> patch = DiffUtils.diff(base, revised);
        var hunks = new ArrayList<Hunk>(patch.getDeltas().size());
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            int start = delta.getSource().getPosition();
            int end = start + delta.getSource().size();
            hunks.add(new Hunk(start, end, List.copyOf(delta.getTarget().getLines())));
        }
        hunks.sort(Comparator.comparingInt(Hunk::start));
        return hunks;
    }

    private static List<String> split(String text) {
        return List.of(text.split("\n", -1));
    }
}
