package org.cflow.ast;

public interface StatementVisitor<R>
{
	R visitBlock(Block block);

	R visitVarDecl(VarDecl varDecl);

	R visitAssign(Assign assign);

	R visitIf(IfStatement ifStatement);

	R visitWhile(WhileStatement whileStatement);

	R visitFor(ForStatement forStatement);

	R visitDoWhile(DoWhileStatement doWhileStatement);

	R visitReturn(ReturnStatement returnStatement);

	R visitOpaque(OpaqueStatement opaqueStatement);
}
