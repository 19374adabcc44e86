// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import com.machinezoo.recompose.tree.*;

/**
 * Server-rendered node cannot be adopted by the client, because the client renders something different at the same path.
 */
public class TreeIncompatibleException extends HydrationException {
	private static final long serialVersionUID = 1L;
	private final NodePath path;
	public NodePath path() {
		return path;
	}
	private final String serverType;
	public String serverType() {
		return serverType;
	}
	private final String clientType;
	public String clientType() {
		return clientType;
	}
	public TreeIncompatibleException(NodePath path, String serverType, String clientType, String reason) {
		super("Cannot adopt server-rendered <" + serverType + "> at " + path + ": " + reason);
		this.path = path;
		this.serverType = serverType;
		this.clientType = clientType;
	}
	public TreeIncompatibleException(NodePath path, String serverType, String clientType) {
		this(path, serverType, clientType, "client renders <" + clientType + ">.");
	}
}
