// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.time.*;
import java.util.*;
import com.google.common.collect.*;
import com.google.gson.*;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.stagean.*;

/**
 * Everything the client needs to adopt server-rendered markup: component tree, saveable state, and hydration markers.
 * Context is created once per server pass and consumed once by the client.
 * State values are kept as JSON trees until the client declares the state with a concrete type.
 */
@StubDocs
public final class HydrationContext {
	private final ComponentNode componentTree;
	public ComponentNode componentTree() {
		return componentTree;
	}
	private final ImmutableMap<String, JsonElement> stateData;
	public Map<String, JsonElement> stateData() {
		return stateData;
	}
	private final ImmutableList<DomMarker> hydrationMarkers;
	public List<DomMarker> hydrationMarkers() {
		return hydrationMarkers;
	}
	private final Instant timestamp;
	public Instant timestamp() {
		return timestamp;
	}
	/**
	 * Creates new context.
	 *
	 * @throws DuplicateMarkerException
	 *             if two markers share an id
	 */
	public HydrationContext(ComponentNode componentTree, Map<String, JsonElement> stateData, List<DomMarker> hydrationMarkers, Instant timestamp) {
		Objects.requireNonNull(componentTree);
		Objects.requireNonNull(stateData);
		Objects.requireNonNull(hydrationMarkers);
		Objects.requireNonNull(timestamp);
		Set<String> ids = new HashSet<>();
		for (DomMarker marker : hydrationMarkers)
			if (!ids.add(marker.id()))
				throw new DuplicateMarkerException(marker.id());
		this.componentTree = componentTree;
		/*
		 * Gson represents JSON null as JsonNull, which ImmutableMap accepts, unlike Java null.
		 */
		Map<String, JsonElement> state = new LinkedHashMap<>();
		for (Map.Entry<String, JsonElement> entry : stateData.entrySet())
			state.put(entry.getKey(), entry.getValue() != null ? entry.getValue() : JsonNull.INSTANCE);
		this.stateData = ImmutableMap.copyOf(state);
		this.hydrationMarkers = ImmutableList.copyOf(hydrationMarkers);
		this.timestamp = timestamp;
	}
	public Optional<DomMarker> marker(String id) {
		for (DomMarker marker : hydrationMarkers)
			if (marker.id().equals(id))
				return Optional.of(marker);
		return Optional.empty();
	}
	public NodePath rootPath() {
		return NodePath.root(componentTree.key());
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof HydrationContext))
			return false;
		HydrationContext other = (HydrationContext)obj;
		return componentTree.equals(other.componentTree)
			&& stateData.equals(other.stateData)
			&& hydrationMarkers.equals(other.hydrationMarkers)
			&& timestamp.equals(other.timestamp);
	}
	@Override
	public int hashCode() {
		return Objects.hash(componentTree, stateData, hydrationMarkers, timestamp);
	}
	@Override
	public String toString() {
		return "hydration context with " + componentTree.size() + " nodes, " + hydrationMarkers.size() + " markers, and " + stateData.size() + " state entries";
	}
}
