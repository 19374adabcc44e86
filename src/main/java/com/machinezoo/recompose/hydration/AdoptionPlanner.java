// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.recompose.*;
import com.machinezoo.recompose.tree.*;

/*
 * Matching is a simultaneous walk of both trees. Under the deep policy, the walk stops at the first difference on every branch
 * and the client subtree at that point becomes a fallback. Siblings of the fallback are still compared and possibly adopted.
 *
 * Child lists are compared as key sequences. When keys differ, pairing children is guesswork,
 * so the whole parent falls back instead of trying to salvage individual children.
 */
/**
 * Computes {@link AdoptionPlan} from server context and freshly computed client tree.
 */
public class AdoptionPlanner {
	private static final Logger logger = LoggerFactory.getLogger(AdoptionPlanner.class);
	private final CompatibilityPolicy policy;
	public CompatibilityPolicy policy() {
		return policy;
	}
	public AdoptionPlanner(CompatibilityPolicy policy) {
		Objects.requireNonNull(policy);
		this.policy = policy;
	}
	public boolean compatible(ComponentNode server, ComponentNode client) {
		List<AdoptionPlan.Fallback> fallbacks = new ArrayList<>();
		compare(server, client, NodePath.root(client.key()), fallbacks, new ArrayList<>());
		return fallbacks.isEmpty();
	}
	private void compare(ComponentNode server, ComponentNode client, NodePath path, List<AdoptionPlan.Fallback> fallbacks, List<TreeIncompatibleException> mismatches) {
		String reason = difference(server, client, path.depth() == 1);
		if (reason != null) {
			fallbacks.add(new AdoptionPlan.Fallback(path, client));
			mismatches.add(new TreeIncompatibleException(path, server.type(), client.type(), reason));
			return;
		}
		if (policy == CompatibilityPolicy.SHALLOW)
			return;
		for (int i = 0; i < client.children().size(); ++i) {
			ComponentNode child = client.children().get(i);
			compare(server.children().get(i), child, path.child(child.key()), fallbacks, mismatches);
		}
	}
	private String difference(ComponentNode server, ComponentNode client, boolean root) {
		if (!server.type().equals(client.type()))
			return "client renders <" + client.type() + ">.";
		if (policy == CompatibilityPolicy.SHALLOW)
			return null;
		if (root && !server.key().equals(client.key()))
			return "server root key is '" + server.key() + "', client root key is '" + client.key() + "'.";
		if (!server.props().equals(client.props()))
			return "props differ.";
		if (!keys(server).equals(keys(client)))
			return "children differ, server has " + keys(server) + ", client has " + keys(client) + ".";
		return null;
	}
	private static List<String> keys(ComponentNode node) {
		List<String> keys = new ArrayList<>();
		for (ComponentNode child : node.children())
			keys.add(child.key());
		return keys;
	}
	/**
	 * Matches server context against client tree.
	 *
	 * @param context
	 *            deserialized server context
	 * @param client
	 *            snapshot of the client composition
	 * @param handlers
	 *            live handlers of the client composition keyed by node path
	 * @return adoption plan
	 */
	public AdoptionPlan plan(HydrationContext context, ComponentNode client, Map<NodePath, Map<String, EventHandler>> handlers) {
		Objects.requireNonNull(context);
		Objects.requireNonNull(client);
		Objects.requireNonNull(handlers);
		NodePath root = NodePath.root(client.key());
		List<AdoptionPlan.Fallback> fallbacks = new ArrayList<>();
		List<TreeIncompatibleException> mismatches = new ArrayList<>();
		compare(context.componentTree(), client, root, fallbacks, mismatches);
		boolean full = fallbacks.stream().anyMatch(f -> f.path().equals(root));
		return build(context, client, handlers, full, fallbacks, mismatches);
	}
	/**
	 * Plans full client rendering, used when the server context is unusable.
	 * Server markers, if known, are all reported as unbound.
	 */
	public AdoptionPlan fullRender(HydrationContext context, ComponentNode client, Map<NodePath, Map<String, EventHandler>> handlers) {
		NodePath root = NodePath.root(client.key());
		List<AdoptionPlan.Fallback> fallbacks = Collections.singletonList(new AdoptionPlan.Fallback(root, client));
		return build(context, client, handlers, true, fallbacks, Collections.emptyList());
	}
	private AdoptionPlan build(HydrationContext context, ComponentNode client, Map<NodePath, Map<String, EventHandler>> handlers, boolean full, List<AdoptionPlan.Fallback> fallbacks, List<TreeIncompatibleException> mismatches) {
		NodePath root = NodePath.root(client.key());
		if (full)
			fallbacks = Collections.singletonList(new AdoptionPlan.Fallback(root, client));
		List<AdoptionPlan.Fallback> fresh = fallbacks;
		Set<String> serverIds = new HashSet<>();
		if (context != null && !full)
			for (DomMarker marker : context.hydrationMarkers())
				serverIds.add(marker.id());
		Set<String> clientIds = new HashSet<>();
		List<MarkerBinding> bindings = new ArrayList<>();
		client.walk(root, (path, node) -> {
			String id = DomMarker.idOf(path, node);
			if (!node.interactive() && !serverIds.contains(id))
				return;
			if (!clientIds.add(id)) {
				logger.warn("Client tree contains duplicate marker id {} at {}. Only the first node is bound.", id, path);
				return;
			}
			boolean inFallback = fresh.stream().anyMatch(f -> path.within(f.path()));
			bindings.add(new MarkerBinding(id, path, node.type(), HydrationPriority.of(node), handlers.getOrDefault(path, Collections.emptyMap()), inFallback));
		});
		/*
		 * List.sort() is stable, so bindings of equal priority stay in document order.
		 */
		bindings.sort(Comparator.comparing(MarkerBinding::priority));
		List<DomMarker> unbound = new ArrayList<>();
		if (context != null)
			for (DomMarker marker : context.hydrationMarkers())
				if (full || !clientIds.contains(marker.id()))
					unbound.add(marker);
		return new AdoptionPlan(root, client, full, fallbacks, bindings, unbound, mismatches);
	}
}
