package de.codesourcery.rebecca.builder;

import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.rebecca.ast.NodeStore;
import de.codesourcery.rebecca.ast.Tree;
import de.codesourcery.rebecca.ast.TreeEditor;
import de.codesourcery.rebecca.lexer.Lexer;
import de.codesourcery.rebecca.lexer.ParseException;
import de.codesourcery.rebecca.lexer.Token;
import de.codesourcery.rebecca.lexer.TokenType;

/**
 * Builds a tree that mirrors the bracket nesting of a token stream.
 *
 * <p>The root is a {@link TokenType#PROGRAM} node. An opening bracket becomes the parent
 * of every token up to and including its closing bracket, all other tokens are leaves.
 * The trailing EOF token is not added.</p>
 */
public class NestingTreeBuilder
{
	private static final Logger LOG = LoggerFactory.getLogger(NestingTreeBuilder.class);

	private final NodeStore store;

	public NestingTreeBuilder(NodeStore store) {
		Validate.notNull(store, "store must not be NULL");
		this.store = store;
	}

	public Tree build(Lexer lexer)
	{
		Validate.notNull(lexer, "lexer must not be NULL");

		final Tree tree = Tree.create( store , TokenType.PROGRAM );
		final TreeEditor editor = new TreeEditor( tree );
		final Deque<Token> openGroups = new ArrayDeque<>();

		while ( ! lexer.peek( TokenType.EOF ) )
		{
			final Token token = lexer.next();
			editor.addChild( tree.createNode( token ) );

			if ( token.type.isOpeningBracket() ) {
				openGroups.push( token );
				continue;
			}
			if ( token.type.isClosingBracket() )
			{
				if ( openGroups.isEmpty() ) {
					throw new ParseException("Unbalanced '"+token.text+"'", token );
				}
				final Token opening = openGroups.pop();
				if ( opening.type.closingBracket() != token.type ) {
					throw new ParseException("Expected '"+opening.type.closingBracket().canonicalText()+"' but got '"+token.text+"'", token );
				}
				editor.parent(); // back to the opening bracket
			}
			editor.parent();
		}
		final Token eof = lexer.next( TokenType.EOF );
		if ( ! openGroups.isEmpty() ) {
			throw new ParseException("Unclosed '"+openGroups.peek().text+"'", eof.offset );
		}
		LOG.debug("Built {}", tree);
		return tree;
	}
}
