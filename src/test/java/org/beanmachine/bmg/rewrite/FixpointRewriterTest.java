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

import java.util.Arrays;
import java.util.Properties;

import org.beanmachine.bmg.FixerContractException;
import org.beanmachine.bmg.RewriteNonTerminationException;
import org.beanmachine.bmg.conf.CompilerConfig;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.BNodeQuery;
import org.beanmachine.bmg.plan.NodeKind;
import org.beanmachine.bmg.types.LatticeTyper;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class FixpointRewriterTest
{
	private BMGraphBuilder bmg;
	private LatticeTyper typer;
	private BNode c;
	private BNode exp;
	private BNodeQuery q;

	@Before
	public void setUp() {
		bmg = new BMGraphBuilder();
		typer = new LatticeTyper(bmg.getGraph());
		c = bmg.addConstant(2.0);
		exp = bmg.addExp(c);
		q = bmg.addQuery(exp);
	}

	@Test
	public void testOscillatingFixerHitsPassCeiling() {
		Properties props = new Properties();
		props.setProperty(CompilerConfig.PASS_CEILING_MIN, "4");
		props.setProperty(CompilerConfig.PASS_CEILING_FACTOR, "1");
		FixpointRewriter rewriter = new FixpointRewriter(bmg, typer, new CompilerConfig(props));

		try {
			rewriter.run(new ExpLogSwapFixer());
			Assert.fail("Expected a RewriteNonTerminationException.");
		}
		catch(RewriteNonTerminationException ex) {
			Assert.assertEquals("swap", ex.getFixerName());
			//max(4, 1*3+1)
			Assert.assertEquals(4, ex.getPasses());
		}
	}

	@Test
	public void testRunOncePolicy() {
		FixpointRewriter rewriter = new FixpointRewriter(bmg, typer, new CompilerConfig());
		ExpLogSwapFixer fixer = new ExpLogSwapFixer() {
			@Override
			public boolean isRunToFixpoint() {
				return false;
			}
		};

		RewriteReport report = rewriter.run(fixer);

		Assert.assertEquals(Arrays.asList(1), report.getReplacementsPerPass());
		Assert.assertFalse(report.reachedFixpoint());
		Assert.assertEquals(NodeKind.LOG, q.getInput(0).getKind());
	}

	@Test(expected = FixerContractException.class)
	public void testMissingReplacement() {
		FixpointRewriter rewriter = new FixpointRewriter(bmg, typer, new CompilerConfig());
		rewriter.run(new TestFixer() {
			@Override
			public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return null;
			}
		});
	}

	@Test(expected = FixerContractException.class)
	public void testCyclicReplacement() {
		FixpointRewriter rewriter = new FixpointRewriter(bmg, typer, new CompilerConfig());
		rewriter.run(new TestFixer() {
			@Override
			public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return bmg.addLog(node);
			}
		});
	}

	@Test
	public void testReplacementByItselfIsIgnored() {
		FixpointRewriter rewriter = new FixpointRewriter(bmg, typer, new CompilerConfig());
		RewriteReport report = rewriter.run(new TestFixer() {
			@Override
			public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return node;
			}
		});

		Assert.assertEquals(Arrays.asList(0), report.getReplacementsPerPass());
		Assert.assertSame(exp, q.getInput(0));
	}

	@Test
	public void testNewNodesAreVisitedInNextPass() {
		FixpointRewriter rewriter = new FixpointRewriter(bmg, typer, new CompilerConfig());
		//exp(c) -> log(c) -> stop
		RewriteReport report = rewriter.run(new TestFixer() {
			@Override
			public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return node.isKind(NodeKind.EXP) || (node.isKind(NodeKind.LOG) && node.getInput(0) == c);
			}
			@Override
			public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return node.isKind(NodeKind.EXP) ? bmg.addLog(c) : bmg.addNegate(c);
			}
		});

		Assert.assertEquals(Arrays.asList(1, 1, 0), report.getReplacementsPerPass());
		Assert.assertEquals(NodeKind.NEGATE, q.getInput(0).getKind());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTyperOfOtherGraph() {
		new FixpointRewriter(bmg, new LatticeTyper(new BMGraphBuilder().getGraph()), new CompilerConfig());
	}

	//matches every exp node
	private static abstract class TestFixer extends ProblemFixer
	{
		@Override
		public String getName() {
			return "test";
		}

		@Override
		public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
			return node.isKind(NodeKind.EXP);
		}
	}

	//exp(x) -> log(x) -> exp(x) -> ...
	private static class ExpLogSwapFixer extends ProblemFixer
	{
		@Override
		public String getName() {
			return "swap";
		}

		@Override
		public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
			return node.isKind(NodeKind.EXP) || node.isKind(NodeKind.LOG);
		}

		@Override
		public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
			return node.isKind(NodeKind.EXP) ?
				bmg.addLog(node.getInput(0)) : bmg.addExp(node.getInput(0));
		}
	}
}
