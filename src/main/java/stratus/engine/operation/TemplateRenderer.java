package stratus.engine.operation;

import stratus.engine.config.ConfigProvider;
import stratus.engine.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{TOKEN}}} placeholders. Each token resolves, in order, from a user or
 * config-mapped parameter, the config/environment value of the same name, a discovered value,
 * and finally the parameter's documented default. A token that resolves nowhere is an error;
 * nothing is ever emitted with a placeholder left in it.
 */
public class TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);
    static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*}}");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}");

    private final ConfigProvider config;
    private final DiscoveredValueResolver discovered;

    public TemplateRenderer(ConfigProvider config, DiscoveredValueResolver discovered) {
        this.config = config;
        this.discovered = discovered;
    }

    /**
     * Render the definition's command template.
     */
    public RenderedCommand render(OperationDefinition definition, ResolvedParameters params) {
        TemplateSpec template = definition.template();
        if (template == null || template.command() == null) {
            throw new ValidationException("Operation " + definition.id() + " has no command template");
        }
        String context = definition.id();
        String command = substitute(template.command(), params, context);
        String vmName = template.vmName() != null ? substitute(template.vmName(), params, context) : null;
        String resourceGroup = template.resourceGroup() != null
                ? substitute(template.resourceGroup(), params, context)
                : null;
        DurationSpec duration = definition.duration();
        return new RenderedCommand(definition.id(), template.type(), command, vmName, resourceGroup,
                duration.category(), duration.expected(), duration.timeout(), duration.staleAfter());
    }

    /**
     * Substitute every token in a text.
     *
     * @param context label used in the error message
     * @throws ValidationException naming every unresolved token
     */
    public String substitute(String text, ResolvedParameters params, String context) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        Set<String> unresolved = new LinkedHashSet<>();

        while (matcher.find()) {
            String token = matcher.group(1).strip();
            // malformed names ({{vm.name}}, {{RESOURCE-GROUP}}) can never resolve
            Optional<String> value = TOKEN.matcher(matcher.group()).matches()
                    ? lookup(token, params)
                    : Optional.empty();
            if (value.isPresent()) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(value.get()));
            } else {
                unresolved.add(token);
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
            }
        }
        matcher.appendTail(out);

        if (!unresolved.isEmpty()) {
            List<String> problems = new ArrayList<>();
            for (String token : unresolved) {
                problems.add("unresolved token {{" + token + "}}");
            }
            throw new ValidationException("Cannot render " + context, problems);
        }
        return out.toString();
    }

    private Optional<String> lookup(String token, ResolvedParameters params) {
        Optional<ResolvedParameters.Value> param = params.get(token);
        if (param.isPresent() && param.get().source() != ValueSource.DEFAULT) {
            return Optional.of(param.get().asString());
        }

        Optional<String> configured = config.get(token);
        if (configured.isPresent()) {
            return configured;
        }

        if (discovered != null) {
            Optional<String> found = discovered.resolve(token);
            if (found.isPresent()) {
                log.debug("Token {} resolved from discovered resources", token);
                return found;
            }
        }

        return param.map(ResolvedParameters.Value::asString);
    }

    /**
     * Tokens referenced by a text, in order of first appearance.
     */
    public static Set<String> tokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group(1));
        }
        return tokens;
    }
}
