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

import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.NodeKind;
import org.beanmachine.bmg.types.BMGLatticeType;
import org.beanmachine.bmg.types.LatticeTyper;

/**
 * Rewrites 1 + (-p) into complement(p) if p is a probability (or boolean).
 * The sum of such operands is a real in general, whereas the complement
 * keeps the probability type that downstream distributions require.
 */
public class ComplementFixer extends ProblemFixer
{
	public static final String NAME = "complement";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
		return getComplementOperand(node, typer) != null;
	}

	@Override
	public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
		BNode operand = getComplementOperand(node, typer);
		if( operand == null )
			return null;

		BNode complement = bmg.addComplement(operand);
		if( LOG.isDebugEnabled() )
			LOG.debug("Applied ComplementFixer: " + node + " -> " + complement + ".");
		return complement;
	}

	//pattern: +(1, -(p)) or +(-(p), 1), p probability
	private BNode getComplementOperand(BNode node, LatticeTyper typer) {
		if( !node.getKind().isAddition() || node.getNumInputs() != 2 )
			return null;

		BNode negate = null;
		if( BNodeRewriteUtils.isConstant(node.getInput(0), 1) )
			negate = node.getInput(1);
		else if( BNodeRewriteUtils.isConstant(node.getInput(1), 1) )
			negate = node.getInput(0);
		if( negate == null || !negate.isKind(NodeKind.NEGATE) )
			return null;

		BNode operand = negate.getInput(0);
		BMGLatticeType type = tryTypeOf(typer, operand);
		return (type != null && type.isProbability()) ? operand : null;
	}
}
