package de.codesourcery.rebecca.ast;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cursor-based builder and mutation surface for a {@link Tree}.
 *
 * <p>Trees are built depth-first: {@link #addChild(Node)} appends below the cursor
 * and moves the cursor down to the new node, {@link #parent()} moves it back up.
 * Any number of editors may work on the same tree, each has its own cursor.</p>
 *
 * <p>Example, building <code>A(B,C)</code>:
 * <pre>
 * final Tree tree = Tree.create( A );
 * final TreeEditor editor = new TreeEditor( tree );
 * editor.addChild( tree.createNodeByType( B ) ); // cursor = B
 * editor.parent();                               // cursor = A
 * editor.addChild( tree.createNodeByType( C ) ); // cursor = C
 * </pre>
 */
public final class TreeEditor
{
	private static final Logger LOG = LoggerFactory.getLogger(TreeEditor.class);

	private final Tree tree;
	private int current = Node.NO_NODE;

	/**
	 * Creates an editor with its cursor on the tree's root, or without
	 * a cursor if the tree is still empty.
	 */
	public TreeEditor(Tree tree)
	{
		Validate.notNull(tree, "tree must not be NULL");
		this.tree = tree;
		if ( tree.hasRoot() ) {
			current = tree.getRoot().id();
		}
	}

	public Tree getTree() {
		return tree;
	}

	/**
	 * @return node under the cursor or <code>null</code> if the tree has no root yet
	 */
	public Node current()
	{
		assertCursorValid();
		return current == Node.NO_NODE ? null : tree.getStore().get( current );
	}

	/**
	 * Moves the cursor to any node that is linked into this editor's tree.
	 */
	public Node moveTo(Node node)
	{
		Validate.notNull(node, "node must not be NULL");
		Validate.isTrue( tree.owns( node ) && node.isAttached() , "node is not linked into this tree: "+node );
		current = node.id();
		return node;
	}

	/**
	 * Appends a detached node as last child of the cursor node and
	 * moves the cursor to it.
	 *
	 * <p>If the tree has no root yet, the node becomes the root.</p>
	 *
	 * @return the new cursor node, always <code>newChild</code>
	 */
	public Node addChild(Node newChild)
	{
		assertCursorValid();
		assertDetached( newChild , "newChild" );

		if ( current == Node.NO_NODE )
		{
			if ( tree.hasRoot() ) {
				throw new IllegalStateException("Tree already has a root, cursor must be positioned first");
			}
			newChild.attached = true;
			tree.setRoot( newChild );
			LOG.trace("New root {}", newChild);
		}
		else
		{
			final Node parent = current();
			link( parent , newChild );
			LOG.trace("Added {} below {}", newChild, parent);
		}
		current = newChild.id();
		return newChild;
	}

	/**
	 * Moves the cursor to the parent of the cursor node.
	 *
	 * @return the new cursor node
	 * @throws NoParentException if the cursor is on the root
	 */
	public Node parent()
	{
		final Node node = current();
		if ( node == null ) {
			throw new IllegalStateException("Tree has no root");
		}
		if ( ! node.hasParent() ) {
			throw new NoParentException( node.id() );
		}
		current = node.parent;
		return current();
	}

	/**
	 * Inserts a new ancestor between the cursor node and its parent.
	 *
	 * @see #insertParent(Node, Node)
	 */
	public Node insertParent(Node newAncestor)
	{
		final Node target = current();
		if ( target == null ) {
			throw new IllegalStateException("Tree has no root");
		}
		return insertParent( target , newAncestor );
	}

	/**
	 * Inserts a new ancestor between a node and its parent.
	 *
	 * <p><code>newAncestor</code> takes over the position of <code>target</code> in the parent's
	 * children (wherever it is), <code>target</code> becomes the only child of <code>newAncestor</code>.
	 * If <code>target</code> was the root, <code>newAncestor</code> becomes the new root.
	 * The cursor ends up on <code>newAncestor</code>.</p>
	 *
	 * @param target linked node of this tree
	 * @param newAncestor detached node of this tree without children
	 * @return <code>newAncestor</code>
	 */
	public Node insertParent(Node target,Node newAncestor)
	{
		assertCursorValid();
		Validate.notNull(target, "target must not be NULL");
		Validate.isTrue( tree.owns( target ) && target.isAttached() , "target is not linked into this tree: "+target );
		assertDetached( newAncestor , "newAncestor" );
		Validate.isTrue( newAncestor.hasNoChildren() , "newAncestor must not have children: "+newAncestor );

		final Node grandParent = target.getParent();
		if ( grandParent != null )
		{
			if ( ! grandParent.children.replace( target.id() , newAncestor.id() ) ) {
				throw new TreeException("Node "+target+" is missing from the children of its parent "+grandParent);
			}
			newAncestor.parent = grandParent.id();
		}
		else
		{
			tree.setRoot( newAncestor );
		}
		newAncestor.attached = true;

		target.parent = Node.NO_NODE;
		link( newAncestor , target );

		LOG.debug("Inserted {} above {}", newAncestor, target);
		current = newAncestor.id();
		return newAncestor;
	}

	/**
	 * Moves all children of another editor's cursor node to the end of
	 * this editor's cursor node, keeping their order.
	 *
	 * <p>The moved subtrees change ownership: afterwards they belong to this editor's tree
	 * and the source node has no children left. Both cursors stay where they are.</p>
	 *
	 * @param source editor on a different tree sharing this tree's node store
	 * @return number of children moved
	 */
	public int appendTree(TreeEditor source)
	{
		Validate.notNull(source, "source must not be NULL");
		Validate.isTrue( source.tree != tree , "Cannot graft a tree onto itself");
		Validate.isTrue( source.tree.getStore() == tree.getStore() , "Trees must share the same node store");

		final Node destNode = current();
		final Node srcNode = source.current();
		if ( destNode == null || srcNode == null ) {
			throw new IllegalStateException("Both trees need a root");
		}
		if ( srcNode.hasNoChildren() ) {
			return 0;
		}

		final int[] childIds = srcNode.children.toIntArray();
		int movedNodes = 0;
		for ( final int childId : childIds )
		{
			final Node child = tree.getStore().get( childId );
			movedNodes += transferOwnership( child );
			child.parent = Node.NO_NODE;
			link( destNode , child );
		}
		srcNode.children.clear();

		source.tree.adjustSize( -movedNodes );
		tree.adjustSize( movedNodes );

		LOG.debug("Moved {} children ({} nodes) from {} to {}", childIds.length, movedNodes, srcNode, destNode);
		return childIds.length;
	}

	public Node getChild(Node node,int index) {
		return tree.getChild( node , index );
	}

	private int transferOwnership(Node subtreeRoot)
	{
		final int[] count = { 0 };
		subtreeRoot.visitParentFirst( n ->
		{
			n.owner = tree.id();
			count[0]++;
		});
		return count[0];
	}

	private static void link(Node parent,Node child)
	{
		if ( parent.children == null ) {
			parent.children = new ChildArray();
		}
		parent.children.add( child.id() );
		child.parent = parent.id();
		child.attached = true;
	}

	private void assertDetached(Node node,String name)
	{
		Validate.notNull(node, name+" must not be NULL");
		Validate.isTrue( tree.owns( node ) , name+" was not created for this tree: "+node );
		Validate.isTrue( ! node.isAttached() , name+" is already linked into the tree: "+node );
	}

	private void assertCursorValid()
	{
		tree.getStore().assertOpen();
		if ( current != Node.NO_NODE && ! tree.owns( tree.getStore().get( current ) ) ) {
			throw new IllegalStateException("Cursor node #"+current+" has been moved to another tree");
		}
	}

	@Override
	public String toString() {
		return "TreeEditor[ cursor: "+( current == Node.NO_NODE ? "<none>" : "#"+current )+" , "+tree+" ]";
	}
}
