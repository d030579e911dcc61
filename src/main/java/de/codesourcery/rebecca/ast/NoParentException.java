package de.codesourcery.rebecca.ast;

public class NoParentException extends TreeException {

	public final int nodeId;

	public NoParentException(int nodeId) {
		super("Node #"+nodeId+" has no parent");
		this.nodeId = nodeId;
	}
}
