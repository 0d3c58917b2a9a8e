package ai.scholar.outline.structure;

import ai.scholar.outline.model.Address;
import ai.scholar.outline.model.Document;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Open section chain of one parse call. Frame {@code d} (1-based) is the open section at depth {@code d}; the
 * document is the implicit frame 0 with the empty address.
 */
public final class HierarchyState {

    /**
     * Numbering scheme of the outline, fixed by the first heading of the body.
     */
    public enum Numbering {
        UNDECIDED,
        NUMBERED,
        UNNUMBERED
    }

    /**
     * An open section and the address it was opened with.
     */
    public record Frame(Address address, int sectionIndex) {

        public Frame {
            Objects.requireNonNull(address, "address");
        }
    }

    private final List<Frame> frames = new ArrayList<>();
    private Numbering numbering = Numbering.UNDECIDED;
    private int topLevelOrdinal;

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public Optional<Frame> top() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
    }

    public Address topAddress() {
        return top().map(Frame::address).orElse(Address.root());
    }

    public Frame frame(int depth) {
        if (depth < 1 || depth > frames.size()) {
            throw new IndexOutOfBoundsException("No open frame at depth " + depth);
        }
        return frames.get(depth - 1);
    }

    /**
     * Arena index of the section open at {@code depth}, or {@link Document#DOCUMENT_INDEX} for depth 0.
     */
    public int sectionIndexAt(int depth) {
        return depth == 0 ? Document.DOCUMENT_INDEX : frame(depth).sectionIndex();
    }

    public void push(Frame frame) {
        Objects.requireNonNull(frame, "frame");
        if (frame.address().length() != frames.size() + 1) {
            throw new IllegalArgumentException("Address " + frame.address() + " does not fit depth " + (frames.size() + 1));
        }
        frames.add(frame);
    }

    /**
     * Closes every frame deeper than {@code depth}.
     */
    public void truncate(int depth) {
        if (depth < 0 || depth > frames.size()) {
            throw new IllegalArgumentException("Cannot truncate to depth " + depth + " from " + frames.size());
        }
        frames.subList(depth, frames.size()).clear();
    }

    public Numbering numbering() {
        return numbering;
    }

    public void decideNumbering(boolean numbered) {
        if (numbering != Numbering.UNDECIDED) {
            throw new IllegalStateException("Numbering already decided: " + numbering);
        }
        numbering = numbered ? Numbering.NUMBERED : Numbering.UNNUMBERED;
    }

    public boolean isUnnumbered() {
        return numbering == Numbering.UNNUMBERED;
    }

    public int nextTopLevelOrdinal() {
        return ++topLevelOrdinal;
    }
}
