package ai.scholar.outline.structure;

import ai.scholar.outline.model.Address;
import ai.scholar.outline.model.Document;
import ai.scholar.outline.model.DocumentBuilder;
import ai.scholar.outline.tei.ContentBlock;
import ai.scholar.outline.tei.Division;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the section tree from the body block stream.
 *
 * <p>The open section chain lives in a {@link HierarchyState} created per call, so one assembler can serve any
 * number of documents, concurrently included. Blocks are consumed strictly in order; the first address that cannot
 * be placed stops the walk and is reported through {@link AssemblyOutcome}, leaving the partial builder to be
 * discarded by the caller.
 */
public class OutlineAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutlineAssembler.class);

    /** Longest text accepted as a back-filled title. */
    static final int MAX_BACKFILL_TITLE_LENGTH = 150;

    private final BlockClassifier classifier;
    private final HierarchyTracker tracker;

    public OutlineAssembler() {
        this(new HierarchyTracker());
    }

    public OutlineAssembler(HierarchyTracker tracker) {
        this(new BlockClassifier(tracker), tracker);
    }

    OutlineAssembler(BlockClassifier classifier, HierarchyTracker tracker) {
        this.classifier = classifier;
        this.tracker = tracker;
    }

    public AssemblyOutcome assemble(List<Division> divisions, DocumentBuilder builder) {
        HierarchyState state = new HierarchyState();
        int position = 0;
        for (Division division : divisions) {
            for (ContentBlock block : division.blocks()) {
                BlockClassification classification = classifier.classify(block, state);
                if (classification.heading()) {
                    Optional<Address> rejected = openSection(classification, state, builder);
                    if (rejected.isPresent()) {
                        return AssemblyOutcome.inconsistent(rejected.get(), position);
                    }
                } else {
                    attachParagraph(block.text(), state, builder);
                }
                position++;
            }
        }
        return AssemblyOutcome.completed();
    }

    /**
     * Opens the section described by a heading classification.
     *
     * @return the candidate address when it cannot be placed, empty on success
     */
    private Optional<Address> openSection(BlockClassification heading, HierarchyState state, DocumentBuilder builder) {
        if (state.numbering() == HierarchyState.Numbering.UNDECIDED) {
            state.decideNumbering(heading.address().isPresent());
        }
        if (state.isUnnumbered()) {
            Address address = Address.of(state.nextTopLevelOrdinal());
            state.truncate(0);
            push(state, builder, Document.DOCUMENT_INDEX, heading.title(), address);
            attachRemainder(heading, state, builder);
            return Optional.empty();
        }

        Address candidate = heading.address().orElseGet(() -> state.topAddress().child(1));
        Relation relation = tracker.relate(state, candidate);
        if (!relation.isConsistent()) {
            Optional<Relation> recovered = tracker.recover(state, candidate);
            if (recovered.isEmpty()) {
                return Optional.of(candidate);
            }
            LOGGER.debug("Section {} placed under {} after inconsistent numbering", candidate,
                    state.frame(recovered.get().anchorDepth()).address());
            relation = recovered.get();
        }

        int anchorDepth = relation.anchorDepth();
        state.truncate(anchorDepth);
        int parentIndex = state.sectionIndexAt(anchorDepth);
        for (int level = anchorDepth + 1; level < candidate.length(); level++) {
            parentIndex = push(state, builder, parentIndex, "", candidate.prefix(level));
        }
        push(state, builder, parentIndex, heading.title(), candidate);
        attachRemainder(heading, state, builder);
        return Optional.empty();
    }

    private int push(HierarchyState state, DocumentBuilder builder, int parentIndex, String title, Address address) {
        int index = builder.addSection(parentIndex, title, address);
        state.push(new HierarchyState.Frame(address, index));
        return index;
    }

    private void attachRemainder(BlockClassification heading, HierarchyState state, DocumentBuilder builder) {
        if (!heading.remainder().isEmpty()) {
            attachParagraph(heading.remainder(), state, builder);
        }
    }

    private void attachParagraph(String text, HierarchyState state, DocumentBuilder builder) {
        if (text.isEmpty()) {
            return;
        }
        Optional<HierarchyState.Frame> top = state.top();
        if (top.isEmpty()) {
            builder.addParagraph(Document.DOCUMENT_INDEX, text);
            return;
        }
        int sectionIndex = top.get().sectionIndex();
        if (builder.sectionName(sectionIndex).isEmpty() && builder.paragraphCount(sectionIndex) == 0) {
            Optional<SentenceSplitter.Split> split = SentenceSplitter.split(text, MAX_BACKFILL_TITLE_LENGTH);
            if (split.isPresent()) {
                builder.fillTitle(sectionIndex, split.get().lead());
                if (!split.get().rest().isEmpty()) {
                    builder.addParagraph(sectionIndex, split.get().rest());
                }
                return;
            }
        }
        builder.addParagraph(sectionIndex, text);
    }
}
