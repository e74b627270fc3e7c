package nl.pim16aap2.beacon.launcher.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEvaluatorTest
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RuleEvaluator linux = new RuleEvaluator(new Platform(Platform.LINUX, "x86_64", "6.8.0"));
    private final RuleEvaluator windows = new RuleEvaluator(new Platform(Platform.WINDOWS, "x86", "10.0"));

    @Test
    void isAllowed_shouldAllowWithoutRules()
        throws Exception
    {
        assertThat(linux.isAllowed(MissingNode.getInstance())).isTrue();
        assertThat(linux.isAllowed(rules("[]"))).isTrue();
    }

    @Test
    void isAllowed_shouldDisallowWhenNoRuleMatches()
        throws Exception
    {
        // setup
        final JsonNode rules = rules("[{\"action\":\"allow\",\"os\":{\"name\":\"osx\"}}]");

        // verify
        assertThat(linux.isAllowed(rules)).isFalse();
        assertThat(windows.isAllowed(rules)).isFalse();
    }

    @Test
    void isAllowed_shouldLetLaterRulesOverrideEarlierOnes()
        throws Exception
    {
        // setup
        final JsonNode rules = rules("""
            [
              {"action": "allow"},
              {"action": "disallow", "os": {"name": "windows"}}
            ]
            """);

        // verify
        assertThat(linux.isAllowed(rules)).isTrue();
        assertThat(windows.isAllowed(rules)).isFalse();
    }

    @Test
    void isAllowed_shouldNeverMatchFeatureRules()
        throws Exception
    {
        // setup
        final JsonNode rules = rules("[{\"action\":\"allow\",\"features\":{\"is_demo_user\":true}}]");

        // verify
        assertThat(linux.isAllowed(rules)).isFalse();
    }

    @Test
    void isAllowed_shouldMatchArchitecture()
        throws Exception
    {
        // setup
        final JsonNode rules = rules("[{\"action\":\"allow\",\"os\":{\"arch\":\"x86\"}}]");

        // verify
        assertThat(windows.isAllowed(rules)).isTrue();
        assertThat(linux.isAllowed(rules)).isFalse();
    }

    @Test
    void isAllowed_shouldMatchVersionPattern()
        throws Exception
    {
        // setup
        final JsonNode matching = rules("[{\"action\":\"allow\",\"os\":{\"name\":\"windows\",\"version\":\"^10\\\\.\"}}]");
        final JsonNode invalid = rules("[{\"action\":\"allow\",\"os\":{\"version\":\"[\"}}]");

        // verify
        assertThat(windows.isAllowed(matching)).isTrue();
        assertThat(windows.isAllowed(invalid)).isFalse();
    }

    private static JsonNode rules(String json)
        throws Exception
    {
        return MAPPER.readTree(json);
    }
}
