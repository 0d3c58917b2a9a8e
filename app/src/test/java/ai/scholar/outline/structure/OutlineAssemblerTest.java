package ai.scholar.outline.structure;

import static org.assertj.core.api.Assertions.assertThat;

import ai.scholar.outline.model.Address;
import ai.scholar.outline.model.Document;
import ai.scholar.outline.model.DocumentBuilder;
import ai.scholar.outline.model.Paragraph;
import ai.scholar.outline.model.Section;
import ai.scholar.outline.tei.ContentBlock;
import ai.scholar.outline.tei.Division;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutlineAssemblerTest {

    private final OutlineAssembler assembler = new OutlineAssembler();

    @Test
    void buildsNestedSectionsFromHeadings() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1", "Introduction"), ContentBlock.paragraph("Text A")),
                Division.of(ContentBlock.heading("1.1", "Background"), ContentBlock.paragraph("Text B")),
                Division.of(ContentBlock.heading("2", "Methods"), ContentBlock.paragraph("Text C")));

        List<Section> top = document.topLevelSections();
        assertThat(top).extracting(Section::name).containsExactly("Introduction", "Methods");
        assertThat(texts(top.get(0))).containsExactly("Text A");
        assertThat(document.children(top.get(0))).singleElement().satisfies(background -> {
            assertThat(background.name()).isEqualTo("Background");
            assertThat(background.address()).isEqualTo(Address.of(1, 1));
            assertThat(texts(background)).containsExactly("Text B");
        });
        assertThat(texts(top.get(1))).containsExactly("Text C");
        assertThat(document.leadingParagraphs()).isEmpty();
    }

    @Test
    void backFillsTitleOfUntitledSection() {
        Document document = assemble(Division.of(
                ContentBlock.heading("1."),
                ContentBlock.paragraph("Introduction. This paper presents a new method.")));

        Section section = document.topLevelSections().get(0);
        assertThat(section.name()).isEqualTo("Introduction");
        assertThat(texts(section)).containsExactly("This paper presents a new method.");
    }

    @Test
    void doesNotBackFillFromLongSentence() {
        String longSentence = "word ".repeat(40).trim() + ". Then more.";
        Document document = assemble(Division.of(ContentBlock.heading("1", ""), ContentBlock.paragraph(longSentence)));

        Section section = document.topLevelSections().get(0);
        assertThat(section.name()).isEmpty();
        assertThat(texts(section)).containsExactly(longSentence);
    }

    @Test
    void opensSubsectionEmbeddedInParagraph() {
        Document document = assemble(Division.of(
                ContentBlock.heading("1", "Introduction"),
                ContentBlock.paragraph("Some text."),
                ContentBlock.paragraph("1.1. Background. Prior work exists.")));

        Section introduction = document.topLevelSections().get(0);
        assertThat(texts(introduction)).containsExactly("Some text.");
        assertThat(document.children(introduction)).singleElement().satisfies(background -> {
            assertThat(background.name()).isEqualTo("Background");
            assertThat(texts(background)).containsExactly("Prior work exists.");
        });
    }

    @Test
    void keepsNumberedListItemsInCurrentSection() {
        Document document = assemble(Division.of(
                ContentBlock.heading("1", "Introduction"),
                ContentBlock.paragraph("We proceed as follows:"),
                ContentBlock.paragraph("3. run the thing."),
                ContentBlock.paragraph("7. stop.")));

        assertThat(document.topLevelSections()).singleElement()
                .satisfies(section -> assertThat(texts(section))
                        .containsExactly("We proceed as follows:", "3. run the thing.", "7. stop."));
    }

    @Test
    void paragraphsBeforeFirstSectionBelongToDocument() {
        Document document = assemble(
                Division.of(ContentBlock.paragraph("Preamble")),
                Division.of(ContentBlock.heading("1", "Introduction"), ContentBlock.paragraph("Body")));

        assertThat(document.leadingParagraphs()).extracting(Paragraph::text).containsExactly("Preamble");
        assertThat(document.topLevelSections()).extracting(Section::name).containsExactly("Introduction");
    }

    @Test
    void captionHeadingsBecomeParagraphs() {
        Document document = assemble(Division.of(
                ContentBlock.heading("1", "Introduction"),
                ContentBlock.heading("Figure 1: Pipeline overview"),
                ContentBlock.paragraph("Text")));

        assertThat(document.topLevelSections()).singleElement()
                .satisfies(section -> assertThat(texts(section)).containsExactly("Figure 1: Pipeline overview", "Text"));
    }

    @Test
    void unnumberedDocumentsAreFlat() {
        Document document = assemble(
                Division.of(ContentBlock.heading("Introduction"), ContentBlock.paragraph("A")),
                Division.of(ContentBlock.heading("Related Work"), ContentBlock.paragraph("1. Early. Systems.")),
                Division.of(ContentBlock.heading("2 Methods"), ContentBlock.paragraph("C")));

        assertThat(document.topLevelSections()).extracting(Section::name)
                .containsExactly("Introduction", "Related Work", "Methods");
        assertThat(document.topLevelSections()).extracting(Section::address)
                .containsExactly(Address.of(1), Address.of(2), Address.of(3));
        assertThat(texts(document.topLevelSections().get(1))).containsExactly("1. Early. Systems.");
    }

    @Test
    void unnumberedHeadingInNumberedDocumentNestsUnderCurrentSection() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1", "Introduction")),
                Division.of(ContentBlock.heading("Motivation"), ContentBlock.paragraph("Why")),
                Division.of(ContentBlock.heading("2", "Methods")));

        List<Section> top = document.topLevelSections();
        assertThat(top).extracting(Section::name).containsExactly("Introduction", "Methods");
        assertThat(document.children(top.get(0))).singleElement().satisfies(motivation -> {
            assertThat(motivation.name()).isEqualTo("Motivation");
            assertThat(motivation.address()).isEqualTo(Address.of(1, 1));
            assertThat(texts(motivation)).containsExactly("Why");
        });
    }

    @Test
    void synthesizesSingleMissingLevel() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1", "Introduction")),
                Division.of(ContentBlock.heading("1.1.1", "Deep"), ContentBlock.paragraph("Text")),
                Division.of(ContentBlock.heading("1.2", "Next")));

        Section introduction = document.topLevelSections().get(0);
        List<Section> children = document.children(introduction);
        assertThat(children).extracting(Section::name).containsExactly("", "Next");
        Section gap = children.get(0);
        assertThat(gap.address()).isEqualTo(Address.of(1, 1));
        assertThat(document.children(gap)).singleElement().satisfies(deep -> {
            assertThat(deep.name()).isEqualTo("Deep");
            assertThat(document.depth(deep)).isEqualTo(3);
        });
    }

    @Test
    void recoversSectionUnderSharedPrefix() {
        DocumentBuilder builder = new DocumentBuilder();
        AssemblyOutcome outcome = assembler.assemble(List.of(
                Division.of(ContentBlock.heading("1", "Introduction")),
                Division.of(ContentBlock.heading("1.1", "Scope")),
                Division.of(ContentBlock.heading("1.1.1", "Detail")),
                Division.of(ContentBlock.heading("1.5", "Skipped Ahead"))), builder);

        assertThat(outcome.isCompleted()).isTrue();
        Document document = builder.build();
        Section introduction = document.topLevelSections().get(0);
        assertThat(document.children(introduction)).extracting(Section::name).containsExactly("Scope", "Skipped Ahead");
    }

    @Test
    void repeatedNumberOpensSiblingSection() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1", "Introduction"), ContentBlock.paragraph("A")),
                Division.of(ContentBlock.heading("1", "Introduction (continued)"), ContentBlock.paragraph("B")),
                Division.of(ContentBlock.heading("2", "Methods"), ContentBlock.paragraph("C")));

        List<Section> top = document.topLevelSections();
        assertThat(top).extracting(Section::name)
                .containsExactly("Introduction", "Introduction (continued)", "Methods");
        assertThat(top).extracting(Section::address).containsExactly(Address.of(1), Address.of(1), Address.of(2));
        assertThat(texts(top.get(1))).containsExactly("B");
    }

    @Test
    void repeatedAncestorNumberClosesSubsections() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1", "Introduction")),
                Division.of(ContentBlock.heading("1.1", "Scope"), ContentBlock.paragraph("A")),
                Division.of(ContentBlock.heading("1", "Introduction"), ContentBlock.paragraph("B")),
                Division.of(ContentBlock.heading("2", "Methods")));

        List<Section> top = document.topLevelSections();
        assertThat(top).extracting(Section::name).containsExactly("Introduction", "Introduction", "Methods");
        assertThat(document.children(top.get(0))).extracting(Section::name).containsExactly("Scope");
        assertThat(document.children(top.get(1))).isEmpty();
        assertThat(texts(top.get(1))).containsExactly("B");
    }

    @Test
    void firstHeadingBelowTopLevelSynthesizesAncestors() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1.1.1", "Setup"), ContentBlock.paragraph("A")),
                Division.of(ContentBlock.heading("1.1.2", "Data"), ContentBlock.paragraph("B")));

        Section first = document.topLevelSections().get(0);
        assertThat(first.name()).isEmpty();
        Section second = document.children(first).get(0);
        assertThat(second.name()).isEmpty();
        assertThat(second.address()).isEqualTo(Address.of(1, 1));
        assertThat(document.children(second)).extracting(Section::name).containsExactly("Setup", "Data");
        assertThat(document.outlineSections()).allSatisfy(
                section -> assertThat(document.depth(section)).isEqualTo(section.address().length()));
    }

    @Test
    void firstHeadingMayStartMidNumbering() {
        Document document = assemble(
                Division.of(ContentBlock.heading("2.3", "Results")),
                Division.of(ContentBlock.heading("2.4", "Discussion")),
                Division.of(ContentBlock.heading("3", "Conclusion")));

        List<Section> top = document.topLevelSections();
        assertThat(top).extracting(Section::address).containsExactly(Address.of(2), Address.of(3));
        assertThat(document.children(top.get(0))).extracting(Section::name).containsExactly("Results", "Discussion");
    }

    @Test
    void embeddedHeadingMayClimbBackToTopLevel() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1", "Introduction")),
                Division.of(ContentBlock.heading("1.1", "Scope")),
                Division.of(ContentBlock.heading("1.2", "Outline"),
                        ContentBlock.paragraph("Text."),
                        ContentBlock.paragraph("2. Methods. We measure things.")));

        List<Section> top = document.topLevelSections();
        assertThat(top).extracting(Section::name).containsExactly("Introduction", "Methods");
        assertThat(texts(top.get(1))).containsExactly("We measure things.");
        Section outline = document.children(top.get(0)).get(1);
        assertThat(outline.name()).isEqualTo("Outline");
        assertThat(texts(outline)).containsExactly("Text.");
    }

    @Test
    void reportsFirstSectionThatCannotBePlaced() {
        AssemblyOutcome outcome = assembler.assemble(List.of(
                Division.of(ContentBlock.heading("1", "Intro")),
                Division.of(ContentBlock.heading("1.1", "Sub")),
                Division.of(ContentBlock.heading("5.3.2", "Odd")),
                Division.of(ContentBlock.heading("1.2", "Back"))), new DocumentBuilder());

        assertThat(outcome.isCompleted()).isFalse();
        assertThat(outcome.offendingAddress()).contains(Address.of(5, 3, 2));
        assertThat(outcome.blockPosition()).isEqualTo(2);
    }

    @Test
    void sectionDepthMatchesAddressLength() {
        Document document = assemble(
                Division.of(ContentBlock.heading("1", "A")),
                Division.of(ContentBlock.heading("1.1", "B")),
                Division.of(ContentBlock.heading("1.1.1.1", "C")),
                Division.of(ContentBlock.heading("1.3", "D")),
                Division.of(ContentBlock.heading("2", "E")),
                Division.of(ContentBlock.heading("2.1", "F")));

        assertThat(document.outlineSections()).allSatisfy(
                section -> assertThat(document.depth(section)).isEqualTo(section.address().length()));
    }

    private Document assemble(Division... divisions) {
        DocumentBuilder builder = new DocumentBuilder();
        AssemblyOutcome outcome = assembler.assemble(List.of(divisions), builder);
        assertThat(outcome.isCompleted()).isTrue();
        return builder.build();
    }

    private static List<String> texts(Section section) {
        return section.paragraphs().stream().map(Paragraph::text).toList();
    }
}
