package nl.pim16aap2.beacon.launcher.resolver;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates the {@code rules} arrays of libraries and arguments.
 * <p>
 * Without rules an element is always allowed. With rules, an element starts out disallowed and every matching rule
 * sets the outcome to its action, so later rules override earlier ones. Rules gated on launcher features never match,
 * because the launcher enables none of them.
 */
public final class RuleEvaluator
{
    private final Platform platform;

    public RuleEvaluator(Platform platform)
    {
        this.platform = Objects.requireNonNull(platform, "platform may not be null.");
    }

    public boolean isAllowed(JsonNode rules)
    {
        if (rules.isMissingNode() || rules.isNull() || !rules.isArray() || rules.isEmpty())
            return true;

        boolean allowed = false;
        for (final JsonNode rule : rules)
        {
            if (matches(rule))
                allowed = "allow".equals(rule.path("action").asText());
        }
        return allowed;
    }

    private boolean matches(JsonNode rule)
    {
        if (rule.has("features"))
            return false;

        final JsonNode os = rule.path("os");
        if (os.isMissingNode())
            return true;

        if (os.has("name") && !platform.osName().equals(os.path("name").asText()))
            return false;
        if (os.has("arch") && !platform.arch().equals(os.path("arch").asText()))
            return false;
        return !os.has("version") || versionMatches(os.path("version").asText());
    }

    private boolean versionMatches(String versionPattern)
    {
        try
        {
            return Pattern.compile(versionPattern).matcher(platform.osVersion()).find();
        }
        catch (PatternSyntaxException exception)
        {
            return false;
        }
    }
}
