package ai.scholar.outline.structure;

import ai.scholar.outline.model.Address;
import java.util.Optional;

/**
 * Relates candidate section addresses to the open section chain of a {@link HierarchyState}.
 *
 * <p>The tracker holds no state of its own. Once a section is open, a relation may open at most one missing
 * intermediate level (for example {@code 1} followed by {@code 1.1.1}); the first section of a document may open any
 * number. The caller synthesizes an untitled section for every missing level.
 */
public class HierarchyTracker {

    private static final int MAX_OPENED_LEVELS = 2;

    public Relation relate(HierarchyState state, Address candidate) {
        if (candidate.isRoot()) {
            return Relation.inconsistent();
        }
        Address top = state.topAddress();
        int depth = state.depth();

        if (depth == 0) {
            return Relation.descend(0);
        }
        if (top.isProperPrefixOf(candidate) && opensLevels(candidate, depth, 1, MAX_OPENED_LEVELS)) {
            return Relation.descend(depth);
        }
        int split = top.firstDifference(candidate);
        if (split < 0 || candidate.get(split) != top.get(split) + 1 || !opensLevels(candidate, split + 1, 0, MAX_OPENED_LEVELS - 1)) {
            return Relation.inconsistent();
        }
        return split == depth - 1 ? Relation.sibling(split) : Relation.ascend(split);
    }

    /**
     * Narrower recovery for an inconsistent candidate, using the deepest open frame whose address is a prefix of the
     * candidate. A proper prefix becomes the candidate's ancestor; an equal address (a repeated number) gets the
     * candidate as its next sibling. The document root does not count, so a candidate sharing no open prefix cannot
     * be recovered.
     */
    public Optional<Relation> recover(HierarchyState state, Address candidate) {
        for (int depth = state.depth(); depth >= 1; depth--) {
            Address open = state.frame(depth).address();
            if (open.equals(candidate)) {
                return Optional.of(Relation.sibling(depth - 1));
            }
            if (open.isProperPrefixOf(candidate)) {
                return Optional.of(Relation.descend(depth));
            }
        }
        return Optional.empty();
    }

    /**
     * True when the candidate has between {@code min} and {@code max} components after {@code from}, each numbered
     * 0 or 1.
     */
    private boolean opensLevels(Address candidate, int from, int min, int max) {
        int opened = candidate.length() - from;
        if (opened < min || opened > max) {
            return false;
        }
        for (int i = from; i < candidate.length(); i++) {
            if (!isFirstChild(candidate.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isFirstChild(int component) {
        return component == 0 || component == 1;
    }
}
