package sh.harold.flotilla.cluster.command;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TableFormatterTest {

    @Test
    void alignsColumnsOnWidestValue() {
        TableFormatter table = new TableFormatter()
                .addHeaders("Setting", "Value")
                .addRow("a", "1")
                .addRow("maxInstances", "20");

        assertThat(table.build("T")).containsExactly(
                "+--------- T ----------+",
                "| Setting      | Value |",
                "+----------------------+",
                "| a            | 1     |",
                "| maxInstances | 20    |",
                "+----------------------+");
    }

    @Test
    void missingValuesAreBlank() {
        TableFormatter table = new TableFormatter().addHeaders("a", "b").addRow("x");

        assertThat(table.build("Title")).contains("| x |   |");
    }
}
