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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.beanmachine.bmg.FixerContractException;
import org.beanmachine.bmg.RewriteNonTerminationException;
import org.beanmachine.bmg.conf.CompilerConfig;
import org.beanmachine.bmg.plan.BMGraph;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.types.LatticeTyper;

/**
 * Drives a single fixer over the whole graph until no node needs fixing.
 *
 * Each pass visits a snapshot of the topological order (operands before
 * consumers) and evaluates the fixer against the current graph; nodes
 * removed earlier in the same pass are skipped, nodes introduced by a
 * replacement are visited in the next pass. Passes repeat until one performs
 * no replacement, bounded by a ceiling derived from the graph size.
 */
public class FixpointRewriter
{
	private static final Log LOG = LogFactory.getLog(FixpointRewriter.class.getName());

	private final BMGraphBuilder _bmg;
	private final LatticeTyper _typer;
	private final CompilerConfig _conf;

	public FixpointRewriter(BMGraphBuilder bmg, LatticeTyper typer, CompilerConfig conf) {
		if( typer.getGraph() != bmg.getGraph() )
			throw new IllegalArgumentException("Typer is bound to a different graph.");
		_bmg = bmg;
		_typer = typer;
		_conf = conf;
	}

	public BMGraphBuilder getBuilder() {
		return _bmg;
	}

	/**
	 * Runs the given fixer to its fixpoint (or once, per the fixer's policy).
	 *
	 * @param fixer fixer to apply
	 * @return report of replacements per pass
	 * @throws FixerContractException if the fixer claims a match but builds
	 *         no replacement, or its replacement would make the graph cyclic
	 * @throws RewriteNonTerminationException if the pass ceiling is exceeded
	 */
	public RewriteReport run(ProblemFixer fixer) {
		BMGraph graph = _bmg.getGraph();
		RewriteReport report = new RewriteReport(fixer.getName());
		int ceiling = _conf.getPassCeiling(graph.size());

		while( true ) {
			if( report.getNumPasses() >= ceiling ) {
				LOG.error("Fixer " + fixer.getName() + " exceeded the pass ceiling of "
					+ ceiling + " (" + report + ").");
				throw new RewriteNonTerminationException(fixer.getName(), report.getNumPasses());
			}

			int numReplaced = rewritePass(graph, fixer);
			report.addPass(numReplaced);
			if( LOG.isDebugEnabled() )
				LOG.debug(fixer.getName() + " pass " + report.getNumPasses()
					+ ": " + numReplaced + " replacements.");

			if( numReplaced == 0 || !fixer.isRunToFixpoint() )
				break;
		}

		return report;
	}

	private int rewritePass(BMGraph graph, ProblemFixer fixer) {
		int numReplaced = 0;
		List<BNode> order = graph.topologicalOrder();
		for( BNode node : order ) {
			//removed by an earlier replacement of this pass
			if( !graph.contains(node) )
				continue;
			if( !fixer.needsFixing(node, _bmg, _typer) )
				continue;

			BNode replacement = fixer.getReplacement(node, _bmg, _typer);
			if( replacement == null ) {
				LOG.error("Fixer " + fixer.getName() + " matched " + node + " but built no replacement.");
				throw new FixerContractException("Fixer " + fixer.getName()
					+ " reported that " + node + " needs fixing but produced no replacement.");
			}
			if( replacement == node )
				continue;

			graph.replace(node, replacement);
			numReplaced++;
		}
		return numReplaced;
	}
}
