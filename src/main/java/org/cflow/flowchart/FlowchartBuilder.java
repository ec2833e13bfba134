package org.cflow.flowchart;

import org.cflow.ast.*;
import org.cflow.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link Program} into a {@link FlowGraph}.
 * <p>
 * Every statement is built into a {@link Fragment}: the node control enters first and
 * the node control leaves from. A fragment without a tail never falls through (every
 * path through it ends in a return); the statements after it in the same block are
 * unreachable and are left out of the graph. Branches and loops end in an invisible
 * merge node so the next statement always has a single predecessor to hang off.
 */
public class FlowchartBuilder implements StatementVisitor<FlowchartBuilder.Fragment>
{
	private static final String TRUE = "true";
	private static final String FALSE = "false";

	private List<GraphNode> nodes;
	private List<GraphEdge> edges;
	private int nodeCount;
	private GraphNode end;

	/**
	 * Builds a new graph. Node ids restart at {@code node1} on every call.
	 */
	public FlowGraph generate(Program program)
	{
		nodes = new ArrayList<>();
		edges = new ArrayList<>();
		nodeCount = 0;

		GraphNode start = newNode(NodeShape.OVAL, "Start");
		end = newNode(NodeShape.OVAL, "End");

		Fragment body = program.body().accept(this);
		if (body.isEmpty())
		{
			connect(start, end, null);
		}
		else
		{
			connect(start, body.entry(), null);
			if (body.fallsThrough())
			{
				connect(body.tail(), end, null);
			}
		}

		Debug.logDebug("Built flowchart with " + nodes.size() + " nodes and " + edges.size() + " edges.");
		return new FlowGraph(nodes, edges, start.id(), end.id());
	}

	@Override
	public Fragment visitBlock(Block block)
	{
		GraphNode entry = null;
		GraphNode tail = null;
		List<Statement> statements = block.statements();
		for (int i = 0; i < statements.size(); i++)
		{
			Fragment fragment = statements.get(i).accept(this);
			if (fragment.isEmpty())
			{
				continue;
			}
			if (entry == null)
			{
				entry = fragment.entry();
			}
			else
			{
				connect(tail, fragment.entry(), null);
			}
			tail = fragment.tail();

			if (!fragment.fallsThrough())
			{
				int skipped = statements.size() - i - 1;
				if (skipped > 0)
				{
					Debug.logWarning("Skipping " + skipped + " unreachable statement(s) starting at '"
							+ AstPrinter.summarize(statements.get(i + 1)) + "'.");
				}
				break;
			}
		}
		return entry == null ? Fragment.EMPTY : new Fragment(entry, tail);
	}

	@Override
	public Fragment visitVarDecl(VarDecl varDecl)
	{
		return process(varDecl);
	}

	@Override
	public Fragment visitAssign(Assign assign)
	{
		return process(assign);
	}

	@Override
	public Fragment visitOpaque(OpaqueStatement opaqueStatement)
	{
		return process(opaqueStatement);
	}

	@Override
	public Fragment visitReturn(ReturnStatement returnStatement)
	{
		GraphNode box = newNode(NodeShape.BOX, AstPrinter.summarize(returnStatement));
		connect(box, end, null);
		return new Fragment(box, null);
	}

	@Override
	public Fragment visitIf(IfStatement ifStatement)
	{
		GraphNode decision = newNode(NodeShape.DIAMOND, ifStatement.condition().text());
		List<Exit> exits = new ArrayList<>();

		branch(decision, TRUE, ifStatement.thenBranch().accept(this), exits);
		Fragment elseFragment = ifStatement.hasElse() ? ifStatement.elseBranch().accept(this) : Fragment.EMPTY;
		branch(decision, FALSE, elseFragment, exits);

		if (exits.isEmpty())
		{
			return new Fragment(decision, null);
		}
		GraphNode merge = newMerge();
		for (Exit exit : exits)
		{
			connect(exit.from(), merge, exit.label());
		}
		return new Fragment(decision, merge);
	}

	@Override
	public Fragment visitWhile(WhileStatement whileStatement)
	{
		GraphNode decision = newNode(NodeShape.DIAMOND, whileStatement.condition().text());
		loopBody(decision, whileStatement.body().accept(this), decision);
		return new Fragment(decision, exitLoop(decision));
	}

	@Override
	public Fragment visitFor(ForStatement forStatement)
	{
		GraphNode init = forStatement.hasInit() ? newNode(NodeShape.BOX, AstPrinter.summarize(forStatement.init())) : null;
		String condition = forStatement.condition().isEmpty() ? TRUE : forStatement.condition().text();
		GraphNode decision = newNode(NodeShape.DIAMOND, condition);
		if (init != null)
		{
			connect(init, decision, null);
		}

		Fragment body = forStatement.body().accept(this);
		GraphNode loopBack = decision;
		if (forStatement.hasUpdate() && (body.isEmpty() || body.fallsThrough()))
		{
			loopBack = newNode(NodeShape.BOX, AstPrinter.summarize(forStatement.update()));
			connect(loopBack, decision, null);
		}
		loopBody(decision, body, loopBack);

		return new Fragment(init != null ? init : decision, exitLoop(decision));
	}

	@Override
	public Fragment visitDoWhile(DoWhileStatement doWhile)
	{
		Fragment body = doWhile.body().accept(this);
		if (!body.isEmpty() && !body.fallsThrough())
		{
			Debug.logWarning("Condition of '" + AstPrinter.summarize(doWhile) + "' is unreachable.");
			return body;
		}

		GraphNode decision = newNode(NodeShape.DIAMOND, doWhile.condition().text());
		if (body.isEmpty())
		{
			connect(decision, decision, TRUE);
			return new Fragment(decision, exitLoop(decision));
		}
		connect(body.tail(), decision, null);
		connect(decision, body.entry(), TRUE);
		return new Fragment(body.entry(), exitLoop(decision));
	}

	private Fragment process(Statement statement)
	{
		GraphNode box = newNode(NodeShape.BOX, AstPrinter.summarize(statement));
		return new Fragment(box, box);
	}

	/**
	 * Wires one arm of a decision. An empty arm goes straight to the merge node.
	 */
	private void branch(GraphNode decision, String label, Fragment arm, List<Exit> exits)
	{
		if (arm.isEmpty())
		{
			exits.add(new Exit(decision, label));
			return;
		}
		connect(decision, arm.entry(), label);
		if (arm.fallsThrough())
		{
			exits.add(new Exit(arm.tail(), null));
		}
	}

	private void loopBody(GraphNode decision, Fragment body, GraphNode loopBack)
	{
		if (body.isEmpty())
		{
			connect(decision, loopBack, TRUE);
			return;
		}
		connect(decision, body.entry(), TRUE);
		if (body.fallsThrough())
		{
			connect(body.tail(), loopBack, null);
		}
	}

	private GraphNode exitLoop(GraphNode decision)
	{
		GraphNode merge = newMerge();
		connect(decision, merge, FALSE);
		return merge;
	}

	private GraphNode newMerge()
	{
		return newNode(NodeShape.INVISIBLE, "");
	}

	private GraphNode newNode(NodeShape shape, String label)
	{
		nodeCount++;
		GraphNode node = new GraphNode("node" + nodeCount, shape, label);
		nodes.add(node);
		return node;
	}

	private void connect(GraphNode from, GraphNode to, String label)
	{
		edges.add(new GraphEdge(from.id(), to.id(), label));
	}

	/**
	 * The part of the graph built for one statement.
	 *
	 * @param entry First node; null for a statement that produced no nodes.
	 * @param tail  Node control leaves from; null when control never falls through.
	 */
	public record Fragment(GraphNode entry, GraphNode tail)
	{
		static final Fragment EMPTY = new Fragment(null, null);

		public boolean isEmpty()
		{
			return entry == null;
		}

		public boolean fallsThrough()
		{
			return tail != null;
		}
	}

	private record Exit(GraphNode from, String label)
	{
	}
}
