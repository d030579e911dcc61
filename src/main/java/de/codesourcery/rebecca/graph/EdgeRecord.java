package de.codesourcery.rebecca.graph;

public final class EdgeRecord
{
	public final int parentId;
	public final int childId;

	public EdgeRecord(int parentId, int childId)
	{
		this.parentId = parentId;
		this.childId = childId;
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof EdgeRecord ) {
			return parentId == ((EdgeRecord) obj).parentId && childId == ((EdgeRecord) obj).childId;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return 31 * parentId + childId;
	}

	@Override
	public String toString() {
		return "edge("+parentId+", "+childId+")";
	}
}
