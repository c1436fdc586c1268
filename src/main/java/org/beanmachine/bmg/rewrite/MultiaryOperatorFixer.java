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

import java.util.List;

import org.beanmachine.bmg.plan.BMGraph;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.NodeKind;
import org.beanmachine.bmg.types.LatticeTyper;

/**
 * Normalizes trees of an associative operator into one n-ary node, e.g.,
 * +(+(a, b), c) into +(a, b, c). Nested operators that are used elsewhere
 * are kept as operands, so no computation gets duplicated. Only the top
 * node of a chain is replaced, so a chain collapses in a single step.
 */
public abstract class MultiaryOperatorFixer extends ProblemFixer
{
	private final NodeKind _binaryKind;
	private final NodeKind _naryKind;

	protected MultiaryOperatorFixer(NodeKind binaryKind, NodeKind naryKind) {
		_binaryKind = binaryKind;
		_naryKind = naryKind;
	}

	@Override
	public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
		if( !BNodeRewriteUtils.isBNodeOfKind(node, _binaryKind, _naryKind) )
			return false;
		//only the top of a chain is rewritten, the flattening covers the rest
		if( isCollapsibleIntoConsumer(node, bmg.getGraph()) )
			return false;
		for( BNode input : node.getInput() )
			if( BNodeRewriteUtils.isCollapsible(bmg.getGraph(), input, _binaryKind, _naryKind) )
				return true;
		return false;
	}

	private boolean isCollapsibleIntoConsumer(BNode node, BMGraph graph) {
		if( graph.getOutDegree(node) != 1 || graph.isRoot(node) )
			return false;
		return BNodeRewriteUtils.isBNodeOfKind(
			graph.getConsumers(node).first(), _binaryKind, _naryKind);
	}

	@Override
	public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
		if( !needsFixing(node, bmg, typer) )
			return null;

		List<BNode> operands = BNodeRewriteUtils.flattenInputs(
			bmg.getGraph(), node, _binaryKind, _naryKind);
		BNode nary = bmg.addNode(_naryKind, operands);

		if( LOG.isDebugEnabled() )
			LOG.debug("Applied " + getClass().getSimpleName() + ": " + node
				+ " -> " + nary + " over " + operands.size() + " operands.");
		return nary;
	}
}
