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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.beanmachine.bmg.BMGCompiler;
import org.beanmachine.bmg.conf.CompilerConfig;
import org.beanmachine.bmg.plan.BMGraph;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.BNodeQuery;
import org.beanmachine.bmg.plan.BMGraphTest;
import org.beanmachine.bmg.plan.NodeKind;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

/**
 * Runs the default pipeline over log(exp(x1) + ... + exp(xk)) in flat,
 * left-associated and right-associated form.
 */
@RunWith(Parameterized.class)
public class LogSumExpPatternTest
{
	enum SumShape {
		FLAT,   //+(e1, e2, ..., ek)
		LEFT,   //(((e1 + e2) + e3) + ...)
		RIGHT,  //(e1 + (e2 + (e3 + ...)))
	}

	private static final int[] NUM_SUMMANDS = new int[] {3, 4, 6};

	@Parameterized.Parameters(name = "{index}: testLogSumExp(k={0}, {1})")
	public static Collection<Object[]> testParams() {
		List<Object[]> params = new ArrayList<>(NUM_SUMMANDS.length*3);
		for( int k : NUM_SUMMANDS )
			for( SumShape shape : SumShape.values() )
				params.add(new Object[] {k, shape});
		return params;
	}

	// instantiated with test params
	public LogSumExpPatternTest(int numSummands, SumShape shape) {
		this.numSummands = numSummands;
		this.shape = shape;
	}

	private final int numSummands;
	private final SumShape shape;

	@Test
	public void testLogSumExp() {
		BMGraphBuilder bmg = new BMGraphBuilder();
		BMGraph graph = bmg.getGraph();
		BNode normal = bmg.addNormal(bmg.addConstant(0.0), bmg.addConstant(1.0));
		List<BNode> operands = new ArrayList<BNode>();
		List<BNode> exps = new ArrayList<BNode>();
		for( int i=0; i<numSummands; i++ ) {
			BNode x = bmg.addSample(normal);
			operands.add(x);
			exps.add(bmg.addExp(x));
		}
		BNodeQuery q = bmg.addQuery(bmg.addLog(buildSum(bmg, exps, shape)));

		List<RewriteReport> reports = BMGCompiler.optimize(bmg, new CompilerConfig());

		BNode lse = q.getInput(0);
		Assert.assertEquals(NodeKind.LOGSUMEXP, lse.getKind());
		Assert.assertEquals(operands, lse.getInput());
		for( BNode exp : exps )
			Assert.assertFalse(graph.contains(exp));
		for( RewriteReport report : reports )
			Assert.assertTrue(report.reachedFixpoint());
		Assert.assertEquals(1, reports.get(3).getNumReplacements());
		//sample x1..xk, normal, two constants, logsumexp, query
		Assert.assertEquals(numSummands + 5, graph.size());
		BMGraphTest.assertConsumerIndexConsistent(graph);
	}

	private static BNode buildSum(BMGraphBuilder bmg, List<BNode> exps, SumShape shape) {
		switch( shape ) {
			case FLAT:
				return bmg.addMultiAddition(exps);
			case LEFT: {
				BNode sum = exps.get(0);
				for( int i=1; i<exps.size(); i++ )
					sum = bmg.addAddition(sum, exps.get(i));
				return sum;
			}
			case RIGHT: {
				BNode sum = exps.get(exps.size()-1);
				for( int i=exps.size()-2; i>=0; i-- )
					sum = bmg.addAddition(exps.get(i), sum);
				return sum;
			}
			default:
				throw new IllegalArgumentException("Unsupported shape: " + shape);
		}
	}
}
