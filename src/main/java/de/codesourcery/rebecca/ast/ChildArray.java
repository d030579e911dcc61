package de.codesourcery.rebecca.ast;

import java.util.Arrays;

/**
 * Ordered children of a node, stored as node ids.
 *
 * <p>Grows by doubling. Apart from appending, the only edits are
 * replacing an id in place and clearing the whole array.</p>
 */
public final class ChildArray
{
	private static final int[] EMPTY = new int[0];

	private int[] data = EMPTY;
	private int size;

	public void add(int id)
	{
		if ( size == data.length ) {
			data = Arrays.copyOf( data , Math.max( 4 , data.length << 1 ) );
		}
		data[size++] = id;
	}

	public int get(int index)
	{
		if ( index < 0 || index >= size ) {
			throw new IndexOutOfBoundsException("Child index "+index+" out of range, size: "+size);
		}
		return data[index];
	}

	public int indexOf(int id)
	{
		for ( int i = 0 ; i < size ; i++ ) {
			if ( data[i] == id ) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Replaces an id by another one, keeping its position.
	 *
	 * @return <code>false</code> if <code>oldId</code> is not part of this array
	 */
	public boolean replace(int oldId,int newId)
	{
		final int idx = indexOf( oldId );
		if ( idx == -1 ) {
			return false;
		}
		data[idx] = newId;
		return true;
	}

	public void clear() {
		data = EMPTY;
		size = 0;
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public int[] toIntArray() {
		return Arrays.copyOf( data , size );
	}

	@Override
	public String toString() {
		return Arrays.toString( toIntArray() );
	}
}
