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

package org.beanmachine.bmg.rewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.commons.lang.ArrayUtils;
import org.beanmachine.bmg.plan.BMGraph;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.BNodeConstant;
import org.beanmachine.bmg.plan.NodeKind;

public class BNodeRewriteUtils
{
	public static boolean isBNodeOfKind( BNode node, NodeKind... kinds ) {
		return node != null && ArrayUtils.contains(kinds, node.getKind());
	}

	public static boolean isConstant( BNode node, double value ) {
		return node instanceof BNodeConstant
			&& ((BNodeConstant) node).isValue(value);
	}

	public static boolean allInputsOfKind( BNode parent, NodeKind kind ) {
		for( BNode input : parent.getInput() )
			if( !input.isKind(kind) )
				return false;
		return true;
	}

	/**
	 * Collects the single operands of all inputs of a parent, in input order,
	 * e.g., [a, b] for +(exp(a), exp(b)).
	 */
	public static List<BNode> getInputOperands( BNode parent ) {
		ArrayList<BNode> ret = new ArrayList<BNode>();
		for( BNode input : parent.getInput() ) {
			if( input.getNumInputs() != 1 ) {
				throw new IllegalArgumentException("Input " + input + " of "
					+ parent + " is not a unary node.");
			}
			ret.add(input.getInput(0));
		}
		return ret;
	}

	/**
	 * Tests if the given input of a parent may be dissolved into the parent:
	 * it must be of one of the given kinds and the parent must be its only use.
	 */
	public static boolean isCollapsible( BMGraph graph, BNode input, NodeKind... kinds ) {
		return isBNodeOfKind(input, kinds) && graph.getOutDegree(input) == 1;
	}

	/**
	 * Flattens nested operators of the given kinds into one operand list,
	 * in left-to-right order. Inputs with other consumers are kept as operands.
	 */
	public static List<BNode> flattenInputs( BMGraph graph, BNode parent, NodeKind... kinds ) {
		ArrayList<BNode> ret = new ArrayList<BNode>();
		Deque<BNode> stack = new ArrayDeque<BNode>();
		pushInputsReversed(parent, stack);
		while( !stack.isEmpty() ) {
			BNode input = stack.pop();
			if( isCollapsible(graph, input, kinds) )
				pushInputsReversed(input, stack);
			else
				ret.add(input);
		}
		return ret;
	}

	private static void pushInputsReversed( BNode parent, Deque<BNode> stack ) {
		List<BNode> inputs = parent.getInput();
		for( int i = inputs.size() - 1; i >= 0; i-- )
			stack.push(inputs.get(i));
	}
}
