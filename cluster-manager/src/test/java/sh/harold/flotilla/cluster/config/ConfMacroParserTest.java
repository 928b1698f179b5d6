package sh.harold.flotilla.cluster.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfMacroParserTest {

    @Test
    void parsesQuotedValues() {
        assertThat(ConfMacroParser.parse("battleName=\"Team game %ClustInstNb%\" set:maxSpecs=4 'hSet:motd=it''s on'"))
                .contains(Map.of(
                        "battleName", "Team game %ClustInstNb%",
                        "set:maxSpecs", "4",
                        "hSet:motd", "its on"));
    }

    @Test
    void keepsDeclarationOrder() {
        assertThat(ConfMacroParser.parse("b=1 a=2 c=3").orElseThrow().keySet()).containsExactly("b", "a", "c");
    }

    @Test
    void blankStringIsEmptyMap() {
        assertThat(ConfMacroParser.parse("   ")).hasValueSatisfying(macros -> assertThat(macros).isEmpty());
        assertThat(ConfMacroParser.parse(null)).hasValueSatisfying(macros -> assertThat(macros).isEmpty());
    }

    @Test
    void rejectsMalformedDefinitions() {
        assertThat(ConfMacroParser.parse("battleName=\"open")).isEmpty();
        assertThat(ConfMacroParser.parse("novalue")).isEmpty();
        assertThat(ConfMacroParser.parse("=value")).isEmpty();
        assertThat(ConfMacroParser.parse("trailing\\")).isEmpty();
    }

    @Test
    void splitsShellWords() {
        assertThat(ConfMacroParser.splitShellWords("/usr/bin/perl  spads.pl \"/etc/spads conf\" a\\ b"))
                .contains(List.of("/usr/bin/perl", "spads.pl", "/etc/spads conf", "a b"));
        assertThat(ConfMacroParser.splitShellWords("say \"a \\\"quoted\\\" word\""))
                .contains(List.of("say", "a \"quoted\" word"));
    }
}
