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

import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.NodeKind;
import org.beanmachine.bmg.types.LatticeTyper;

/**
 * Rewrites log(exp(a) + exp(b) + ...) into logsumexp(a, b, ...), keeping the
 * order of the summands. Sums are only recognized in their n-ary form, so
 * this fixer depends on {@link MultiaryAdditionFixer} running first.
 */
public class LogSumExpFixer extends ProblemFixer
{
	public static final String NAME = "logsumexp";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
		return node.isKind(NodeKind.LOG)
			&& canBeLogSumExp(node.getInput(0));
	}

	//pattern: +(exp, exp, ...), all or nothing
	private static boolean canBeLogSumExp(BNode operand) {
		return operand.isKind(NodeKind.MULTI_ADDITION)
			&& BNodeRewriteUtils.allInputsOfKind(operand, NodeKind.EXP);
	}

	@Override
	public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
		if( !needsFixing(node, bmg, typer) )
			return null;

		BNode sum = node.getInput(0);
		List<BNode> operands = BNodeRewriteUtils.getInputOperands(sum);
		BNode lse = bmg.addLogSumExp(operands);

		if( LOG.isDebugEnabled() )
			LOG.debug("Applied LogSumExpFixer: " + node + " -> " + lse
				+ " over " + operands.size() + " operands.");
		return lse;
	}
}
