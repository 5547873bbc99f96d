package com.docinsight.core.validator.rules;

import com.docinsight.core.validator.DiagramSyntax;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FloatingNoteRule}.
 */
class FloatingNoteRuleTest {

    private final FloatingNoteRule rule = new FloatingNoteRule();
    private final DiagramSyntax component = new DiagramSyntax(false, false);
    private final DiagramSyntax sequence = new DiagramSyntax(false, true);

    @Test
    void apply_inlineNote_becomesNumberedBlock() {
        String fixed = rule.apply("A --> B\nnote \"first\\nsecond\"", component);

        assertThat(fixed).isEqualTo("A --> B\nnote as AutoNote1\n  first\n  second\nend note");
    }

    @Test
    void apply_inlineNoteWithAlias_keepsAlias() {
        assertThat(rule.apply("note \"Hello\" as N1", component)).isEqualTo("note as N1\n  Hello\nend note");
    }

    @Test
    void apply_existingAutoNotes_continuesNumbering() {
        String text = "note as AutoNote3\n  old\nend note\nnote \"new\"";

        assertThat(rule.apply(text, component)).endsWith("note as AutoNote4\n  new\nend note");
    }

    @Test
    void apply_emptyInlineNote_isDropped() {
        assertThat(rule.apply("A --> B\nnote \"\"", component)).isEqualTo("A --> B\n");
    }

    @Test
    void apply_endNoteWithAlias_isReduced() {
        String fixed = rule.apply("note as N1\n    text\n\nend note as N1", component);

        assertThat(fixed).isEqualTo("note as N1\n  text\nend note");
    }

    @Test
    void apply_sequenceDiagram_attachesNoteToFirstParticipant() {
        String text = "participant Api\nparticipant Db\nnote as N1\n  first\n  second\nend note";

        assertThat(rule.apply(text, sequence))
            .isEqualTo("participant Api\nparticipant Db\nnote over Api: first second");
    }

    @Test
    void apply_blockWithoutEnd_leftUntouched() {
        String text = "note as N1\n  dangling";

        assertThat(rule.apply(text, component)).isEqualTo(text);
    }

    @Test
    void apply_ownOutput_isUnchanged() {
        String once = rule.apply("note \"a\\nb\"\nnote \"c\" as X", component);

        assertThat(rule.apply(once, component)).isEqualTo(once);
    }
}
