package io.compositor.di;

import io.compositor.di.plan.Node;
import io.compositor.di.plan.NodePlaceholder;
import io.compositor.di.plan.Nodes;
import io.compositor.di.plan.PlaceholderReplacer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Parameter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.compositor.di.util.Utils.checkNotNull;
import static java.util.Collections.unmodifiableMap;

/**
 * Constructor parameters whose values are supplied explicitly instead of being resolved.
 * <p>
 * Each overridden parameter gets a placeholder, which is put into the constructor call
 * before interception, and is swapped for the real node afterwards. This way
 * interceptors never process the override nodes a second time.
 */
public final class ParameterOverrides {
	private final Map<Parameter, NodePlaceholder> placeholders;
	private final Map<NodePlaceholder, Node> replacements;

	private ParameterOverrides(Map<Parameter, NodePlaceholder> placeholders, Map<NodePlaceholder, Node> replacements) {
		this.placeholders = placeholders;
		this.replacements = replacements;
	}

	public static ParameterOverrides of(@NotNull Map<Parameter, ? extends Node> overrides) {
		Map<Parameter, NodePlaceholder> placeholders = new LinkedHashMap<>();
		Map<NodePlaceholder, Node> replacements = new HashMap<>();
		overrides.forEach((parameter, node) -> {
			checkNotNull(parameter, "parameter");
			checkNotNull(node, "Override node of parameter " + parameter);
			NodePlaceholder placeholder = Nodes.placeholder(parameter.getType());
			placeholders.put(parameter, placeholder);
			replacements.put(placeholder, node);
		});
		return new ParameterOverrides(unmodifiableMap(placeholders), unmodifiableMap(replacements));
	}

	@Nullable
	public NodePlaceholder getPlaceholder(@NotNull Parameter parameter) {
		return placeholders.get(parameter);
	}

	public Map<Parameter, NodePlaceholder> getPlaceholders() {
		return placeholders;
	}

	public Node replacePlaceholders(@NotNull Node node) {
		return PlaceholderReplacer.replaceAll(node, replacements);
	}

	public boolean isEmpty() {
		return placeholders.isEmpty();
	}
}
