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
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.beanmachine.bmg.FixerContractException;
import org.beanmachine.bmg.conf.CompilerConfig;
import org.beanmachine.bmg.io.GraphSerde;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.BNodeQuery;
import org.beanmachine.bmg.plan.NodeKind;
import org.beanmachine.bmg.types.LatticeTyper;
import org.junit.Assert;
import org.junit.Test;

public class FixerPipelineTest
{
	@Test
	public void testNormalizerEnablesLogSumExp() {
		BMGraphBuilder bmg = new BMGraphBuilder();
		List<BNode> samples = addSamples(bmg, 3);
		BNodeQuery q = bmg.addQuery(bmg.addLog(bmg.addAddition(
			bmg.addAddition(bmg.addExp(samples.get(0)), bmg.addExp(samples.get(1))),
			bmg.addExp(samples.get(2)))));

		List<RewriteReport> reports = createPipeline(bmg, new CompilerConfig()).run();

		Assert.assertEquals(NodeKind.LOGSUMEXP, q.getInput(0).getKind());
		Assert.assertEquals(samples, q.getInput(0).getInput());
		Assert.assertEquals(Arrays.asList("complement", "multiary_addition",
			"multiary_multiplication", "logsumexp"), getFixerNames(reports));
		Assert.assertEquals(1, reports.get(1).getNumReplacements());
		Assert.assertEquals(1, reports.get(3).getNumReplacements());
	}

	@Test
	public void testLogSumExpAloneLeavesChain() {
		BMGraphBuilder bmg = new BMGraphBuilder();
		List<BNode> samples = addSamples(bmg, 3);
		BNode log = bmg.addLog(bmg.addAddition(
			bmg.addAddition(bmg.addExp(samples.get(0)), bmg.addExp(samples.get(1))),
			bmg.addExp(samples.get(2))));
		BNodeQuery q = bmg.addQuery(log);
		String before = GraphSerde.serialize(bmg.getGraph());

		Properties props = new Properties();
		props.setProperty(CompilerConfig.FIXERS, "logsumexp");
		List<RewriteReport> reports = createPipeline(bmg, new CompilerConfig(props)).run();

		Assert.assertEquals(1, reports.size());
		Assert.assertEquals(0, reports.get(0).getNumReplacements());
		Assert.assertSame(log, q.getInput(0));
		Assert.assertEquals(before, GraphSerde.serialize(bmg.getGraph()));
	}

	@Test
	public void testPipelineIsDeterministic() {
		BMGraphBuilder bmg1 = buildMixedModel();
		BMGraphBuilder bmg2 = buildMixedModel();

		createPipeline(bmg1, new CompilerConfig()).run();
		createPipeline(bmg2, new CompilerConfig()).run();

		Assert.assertEquals(GraphSerde.serialize(bmg1.getGraph()),
			GraphSerde.serialize(bmg2.getGraph()));
	}

	@Test
	public void testNoPatternRemainsAfterPipeline() {
		BMGraphBuilder bmg = buildMixedModel();
		LatticeTyper typer = new LatticeTyper(bmg.getGraph());
		FixerPipeline pipeline = FixerPipeline.fromConfig(bmg, typer, new CompilerConfig());
		pipeline.run();

		for( ProblemFixer fixer : pipeline.getFixers() )
			for( BNode node : bmg.getGraph().topologicalOrder() )
				Assert.assertFalse(fixer + " matches " + node, fixer.needsFixing(node, bmg, typer));
	}

	@Test
	public void testFailureInvalidatesGraph() {
		BMGraphBuilder bmg = new BMGraphBuilder();
		bmg.addQuery(bmg.addExp(bmg.addConstant(2.0)));
		LatticeTyper typer = new LatticeTyper(bmg.getGraph());
		FixerPipeline pipeline = new FixerPipeline(
			new FixpointRewriter(bmg, typer, new CompilerConfig()));
		pipeline.addFixer(new MultiaryAdditionFixer()).addFixer(new ProblemFixer() {
			@Override
			public String getName() {
				return "broken";
			}
			@Override
			public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return node.isKind(NodeKind.EXP);
			}
			@Override
			public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return null;
			}
		});

		try {
			pipeline.run();
			Assert.fail("Expected a FixerContractException.");
		}
		catch(FixerContractException ex) {
			Assert.assertTrue(ex.getMessage().contains("broken"));
		}
		Assert.assertFalse(bmg.getGraph().isValid());
		try {
			bmg.getGraph().topologicalOrder();
			Assert.fail("Expected an IllegalStateException.");
		}
		catch(IllegalStateException ex) {
			Assert.assertTrue(ex.getCause() instanceof FixerContractException);
		}
	}

	@Test
	public void testRuntimeErrorInvalidatesGraph() {
		BMGraphBuilder bmg = new BMGraphBuilder();
		final BNode three = bmg.addConstant(3.0);
		bmg.addQuery(bmg.addExp(three));
		bmg.addQuery(bmg.addExp(bmg.addConstant(2.0)));
		LatticeTyper typer = new LatticeTyper(bmg.getGraph());
		FixerPipeline pipeline = new FixerPipeline(
			new FixpointRewriter(bmg, typer, new CompilerConfig()));
		pipeline.addFixer(new ProblemFixer() {
			@Override
			public String getName() {
				return "exp_to_log";
			}
			@Override
			public boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				return node.isKind(NodeKind.EXP);
			}
			@Override
			public BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer) {
				//the second rewrite fails after the first one was applied
				if( node.getInput(0) == three )
					return bmg.addLog(three);
				return bmg.addNode(NodeKind.LOGSUMEXP, new ArrayList<BNode>());
			}
		});

		try {
			pipeline.run();
			Assert.fail("Expected a FixerContractException.");
		}
		catch(FixerContractException ex) {
			Assert.assertTrue(ex.getMessage().contains("exp_to_log"));
			Assert.assertTrue(ex.getCause() instanceof IllegalArgumentException);
		}
		Assert.assertFalse(bmg.getGraph().isValid());
		try {
			bmg.getGraph().topologicalOrder();
			Assert.fail("Expected an IllegalStateException.");
		}
		catch(IllegalStateException ex) {
			Assert.assertTrue(ex.getCause() instanceof FixerContractException);
		}
	}

	@Test
	public void testVeryDeepSumUnderLog() {
		int n = 20000;
		BMGraphBuilder bmg = new BMGraphBuilder();
		List<BNode> samples = addSamples(bmg, n);
		BNode sum = bmg.addAddition(bmg.addExp(samples.get(0)), bmg.addExp(samples.get(1)));
		for( int i=2; i<n; i++ )
			sum = bmg.addAddition(sum, bmg.addExp(samples.get(i)));
		BNodeQuery q = bmg.addQuery(bmg.addLog(sum));

		List<RewriteReport> reports = createPipeline(bmg, new CompilerConfig()).run();

		Assert.assertTrue(bmg.getGraph().isValid());
		Assert.assertEquals(NodeKind.LOGSUMEXP, q.getInput(0).getKind());
		Assert.assertEquals(samples, q.getInput(0).getInput());
		Assert.assertEquals(1, reports.get(1).getNumReplacements());
		Assert.assertEquals(1, reports.get(3).getNumReplacements());
	}

	@Test
	public void testCreateFixer() {
		Assert.assertTrue(FixerPipeline.createFixer("logsumexp") instanceof LogSumExpFixer);
		Assert.assertTrue(FixerPipeline.createFixer("complement") instanceof ComplementFixer);
		Assert.assertTrue(FixerPipeline.createFixer("multiary_addition") instanceof MultiaryAdditionFixer);
		Assert.assertTrue(FixerPipeline.createFixer("multiary_multiplication") instanceof MultiaryMultiplicationFixer);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownFixer() {
		Properties props = new Properties();
		props.setProperty(CompilerConfig.FIXERS, "logsumexp,unknown");
		BMGraphBuilder bmg = new BMGraphBuilder();
		createPipeline(bmg, new CompilerConfig(props));
	}

	private static FixerPipeline createPipeline(BMGraphBuilder bmg, CompilerConfig conf) {
		return FixerPipeline.fromConfig(bmg, new LatticeTyper(bmg.getGraph()), conf);
	}

	private static List<BNode> addSamples(BMGraphBuilder bmg, int num) {
		BNode normal = bmg.addNormal(bmg.addConstant(0.0), bmg.addConstant(1.0));
		List<BNode> ret = new ArrayList<BNode>();
		for( int i=0; i<num; i++ )
			ret.add(bmg.addSample(normal));
		return ret;
	}

	private static List<String> getFixerNames(List<RewriteReport> reports) {
		List<String> ret = new ArrayList<String>();
		for( RewriteReport report : reports )
			ret.add(report.getFixerName());
		return ret;
	}

	//log-sum-exp over a chain, a complement and a product chain sharing one sample
	private static BMGraphBuilder buildMixedModel() {
		BMGraphBuilder bmg = new BMGraphBuilder();
		List<BNode> x = addSamples(bmg, 3);
		BNode two = bmg.addConstant(2.0);
		BNode p = bmg.addSample(bmg.addBeta(two, two));

		BNode sum = bmg.addAddition(bmg.addExp(x.get(0)),
			bmg.addAddition(bmg.addExp(x.get(1)), bmg.addExp(x.get(2))));
		bmg.addQuery(bmg.addLog(sum));
		bmg.addQuery(bmg.addAddition(bmg.addConstant(1.0), bmg.addNegate(p)));
		bmg.addQuery(bmg.addMultiplication(bmg.addMultiplication(p, x.get(0)), two));
		bmg.addObservation(p, 0.25);
		return bmg;
	}
}
