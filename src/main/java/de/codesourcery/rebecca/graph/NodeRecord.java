package de.codesourcery.rebecca.graph;

import java.util.Objects;

public final class NodeRecord
{
	public final int id;
	public final NodeShape shape;
	public final NodeColor color;
	public final String text;
	// canonical spelling, only set when it differs from text
	public final String secondaryText;

	public NodeRecord(int id, NodeShape shape, NodeColor color, String text, String secondaryText)
	{
		this.id = id;
		this.shape = shape;
		this.color = color;
		this.text = text;
		this.secondaryText = secondaryText;
	}

	public boolean hasSecondaryText() {
		return secondaryText != null;
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof NodeRecord )
		{
			final NodeRecord other = (NodeRecord) obj;
			return id == other.id && shape == other.shape && color == other.color &&
					text.equals( other.text ) && Objects.equals( secondaryText , other.secondaryText );
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash( Integer.valueOf( id ) , shape , color , text , secondaryText );
	}

	@Override
	public String toString() {
		return "node("+id+", "+shape.dotName+", "+color.dotName+", "+text+( secondaryText != null ? ", "+secondaryText : "" )+")";
	}
}
