package org.cflow.ast;

/**
 * Renders an AST as an indented text tree for display, and single statements as the
 * one-line labels used in the flowchart.
 */
public class AstPrinter implements StatementVisitor<Void>
{
	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();
	private int depth = 0;

	public static String print(Program program)
	{
		AstPrinter printer = new AstPrinter();
		printer.line("Program");
		printer.depth++;
		program.body().accept(printer);
		return printer.out.toString();
	}

	/**
	 * One-line source-like rendering of a statement, e.g. {@code int x = 5} or
	 * {@code while (i < n)}. Compound statements render only their header.
	 */
	public static String summarize(Statement statement)
	{
		if (statement instanceof VarDecl varDecl)
		{
			String declaration = varDecl.typeName() + " " + varDecl.name();
			return varDecl.hasInitializer() ? declaration + " = " + varDecl.initializer().text() : declaration;
		}
		if (statement instanceof Assign assign)
		{
			return assign.target() + " = " + assign.value().text();
		}
		if (statement instanceof ReturnStatement returnStatement)
		{
			return returnStatement.value().isEmpty() ? "return" : "return " + returnStatement.value().text();
		}
		if (statement instanceof OpaqueStatement opaque)
		{
			return opaque.text().isEmpty() ? ";" : opaque.text().text();
		}
		if (statement instanceof IfStatement ifStatement)
		{
			return "if (" + ifStatement.condition().text() + ")";
		}
		if (statement instanceof WhileStatement whileStatement)
		{
			return "while (" + whileStatement.condition().text() + ")";
		}
		if (statement instanceof ForStatement forStatement)
		{
			String init = forStatement.hasInit() ? summarize(forStatement.init()) : "";
			String update = forStatement.hasUpdate() ? summarize(forStatement.update()) : "";
			return "for (" + init + "; " + forStatement.condition().text() + "; " + update + ")";
		}
		if (statement instanceof DoWhileStatement doWhile)
		{
			return "do ... while (" + doWhile.condition().text() + ")";
		}
		return "{ ... }";
	}

	@Override
	public Void visitBlock(Block block)
	{
		line("Block");
		children(block);
		return null;
	}

	@Override
	public Void visitVarDecl(VarDecl varDecl)
	{
		line("VarDecl: " + summarize(varDecl));
		return null;
	}

	@Override
	public Void visitAssign(Assign assign)
	{
		line("Assign: " + summarize(assign));
		return null;
	}

	@Override
	public Void visitIf(IfStatement ifStatement)
	{
		line("If: " + ifStatement.condition().text());
		depth++;
		line("Then");
		children(ifStatement.thenBranch());
		if (ifStatement.hasElse())
		{
			line("Else");
			children(ifStatement.elseBranch());
		}
		depth--;
		return null;
	}

	@Override
	public Void visitWhile(WhileStatement whileStatement)
	{
		line("While: " + whileStatement.condition().text());
		children(whileStatement.body());
		return null;
	}

	@Override
	public Void visitFor(ForStatement forStatement)
	{
		line("For: " + forStatement.condition().text());
		depth++;
		if (forStatement.hasInit())
		{
			line("Init");
			depth++;
			forStatement.init().accept(this);
			depth--;
		}
		if (forStatement.hasUpdate())
		{
			line("Update");
			depth++;
			forStatement.update().accept(this);
			depth--;
		}
		line("Body");
		children(forStatement.body());
		depth--;
		return null;
	}

	@Override
	public Void visitDoWhile(DoWhileStatement doWhile)
	{
		line("DoWhile: " + doWhile.condition().text());
		children(doWhile.body());
		return null;
	}

	@Override
	public Void visitReturn(ReturnStatement returnStatement)
	{
		line("Return: " + returnStatement.value().text());
		return null;
	}

	@Override
	public Void visitOpaque(OpaqueStatement opaque)
	{
		line("Opaque: " + opaque.text().text());
		return null;
	}

	private void children(Block block)
	{
		depth++;
		for (Statement statement : block.statements())
		{
			statement.accept(this);
		}
		depth--;
	}

	private void line(String text)
	{
		out.append(INDENT.repeat(depth)).append(text).append('\n');
	}
}
