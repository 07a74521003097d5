package dk.eventchain.components.common;

import org.junit.jupiter.api.Test;

import static dk.eventchain.components.common.MessageFormatter.NamedArgumentBinding.arg;
import static dk.eventchain.components.common.MessageFormatter.*;
import static org.assertj.core.api.Assertions.assertThat;

class MessageFormatterTest {
    @Test
    void verify_msg_replaces_placeholders_in_order() {
        assertThat(msg("Expected version {} but got {}", 2, 3)).isEqualTo("Expected version 2 but got 3");
        assertThat(msg("No placeholders")).isEqualTo("No placeholders");
    }

    @Test
    void verify_msg_formats_a_trailing_exception_as_an_argument() {
        assertThat(msg("Failed with {}", new IllegalStateException("boom"))).isEqualTo("Failed with java.lang.IllegalStateException: boom");
    }

    @Test
    void verify_bind_replaces_every_occurrence_of_a_named_placeholder() {
        var sql = bind("CREATE INDEX {:tableName}_idx ON {:tableName} ({:column})",
                       arg("tableName", "stored_events"),
                       arg("column", "notification_id"));

        assertThat(sql).isEqualTo("CREATE INDEX stored_events_idx ON stored_events (notification_id)");
    }
}
