package org.cflow.ast;

/**
 * A statement of the main function body. The set of variants is closed; passes
 * dispatch over it through {@link StatementVisitor}.
 */
public sealed interface Statement
		permits Block, VarDecl, Assign, IfStatement, WhileStatement, ForStatement, DoWhileStatement, ReturnStatement, OpaqueStatement
{
	<R> R accept(StatementVisitor<R> visitor);
}
