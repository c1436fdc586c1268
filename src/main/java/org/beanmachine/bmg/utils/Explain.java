/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.beanmachine.bmg.utils;

import java.util.ArrayList;

import org.apache.commons.lang.StringUtils;
import org.beanmachine.bmg.plan.BMGraph;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.BNodeConstant;
import org.beanmachine.bmg.types.LatticeTyper;
import org.beanmachine.bmg.types.UntypableNodeException;

/**
 * Human-readable renderings of a graph for logs and debugging.
 */
public class Explain
{
	/**
	 * One line per reachable node in topological order, e.g.,
	 * <pre>(4) log [3]</pre>
	 */
	public static String explainGraph(BMGraph graph) {
		return explainGraph(graph, null);
	}

	/**
	 * Like {@link #explainGraph(BMGraph)}, annotated with lattice types if a
	 * typer is given.
	 */
	public static String explainGraph(BMGraph graph, LatticeTyper typer) {
		StringBuilder sb = new StringBuilder();
		for( BNode node : graph.topologicalOrder() ) {
			sb.append("(").append(node.getID()).append(") ");
			sb.append(getNodeLabel(node));
			sb.append(" [").append(StringUtils.join(getInputIDs(node), ',')).append("]");
			if( typer != null )
				sb.append(" : ").append(explainType(typer, node));
			if( graph.isRoot(node) )
				sb.append(" root");
			sb.append('\n');
		}
		return sb.toString();
	}

	/**
	 * Graphviz rendering; edges point from operand to consumer and are
	 * labelled with the operand position.
	 */
	public static String toDot(BMGraph graph) {
		StringBuilder sb = new StringBuilder();
		sb.append("digraph \"graph\" {\n");
		for( BNode node : graph.topologicalOrder() ) {
			sb.append("  N").append(node.getID());
			sb.append("[label=\"").append(StringUtils.replace(getNodeLabel(node), "\"", "\\\"")).append("\"]");
			sb.append(";\n");
		}
		for( BNode node : graph.topologicalOrder() ) {
			for( int i=0; i<node.getNumInputs(); i++ ) {
				sb.append("  N").append(node.getInput(i).getID());
				sb.append(" -> N").append(node.getID());
				sb.append("[label=").append(i).append("];\n");
			}
		}
		sb.append("}\n");
		return sb.toString();
	}

	public static String getNodeLabel(BNode node) {
		if( node instanceof BNodeConstant )
			return Double.toString(((BNodeConstant) node).getValue());
		return node.getKind().getLabel();
	}

	private static ArrayList<Long> getInputIDs(BNode node) {
		ArrayList<Long> ret = new ArrayList<Long>();
		for( BNode input : node.getInput() )
			ret.add(input.getID());
		return ret;
	}

	private static String explainType(LatticeTyper typer, BNode node) {
		try {
			return typer.typeOf(node).name();
		}
		catch(UntypableNodeException ex) {
			return "UNTYPABLE";
		}
	}
}
