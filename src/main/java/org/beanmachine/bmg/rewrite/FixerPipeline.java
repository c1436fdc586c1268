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
import java.util.Collections;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.beanmachine.bmg.BMGCompilerException;
import org.beanmachine.bmg.FixerContractException;
import org.beanmachine.bmg.conf.CompilerConfig;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.types.LatticeTyper;

/**
 * Applies an ordered list of fixers to one graph. Each fixer runs to its own
 * fixpoint before the next one starts, so later fixers only see the output
 * of earlier ones. The default order establishes the n-ary normal form of
 * sums before the log-sum-exp fusion.
 */
public class FixerPipeline
{
	private static final Log LOG = LogFactory.getLog(FixerPipeline.class.getName());

	private final FixpointRewriter _rewriter;
	private final ArrayList<ProblemFixer> _fixers;

	public FixerPipeline(FixpointRewriter rewriter) {
		_rewriter = rewriter;
		_fixers = new ArrayList<ProblemFixer>();
	}

	public FixerPipeline(FixpointRewriter rewriter, List<ProblemFixer> fixers) {
		this(rewriter);
		_fixers.addAll(fixers);
	}

	/**
	 * Creates a pipeline with the fixers named in the config, in order.
	 */
	public static FixerPipeline fromConfig(BMGraphBuilder bmg, LatticeTyper typer, CompilerConfig conf) {
		FixerPipeline pipeline = new FixerPipeline(new FixpointRewriter(bmg, typer, conf));
		for( String name : conf.getFixers() )
			pipeline.addFixer(createFixer(name));
		return pipeline;
	}

	public static ProblemFixer createFixer(String name) {
		if( ComplementFixer.NAME.equals(name) )
			return new ComplementFixer();
		else if( MultiaryAdditionFixer.NAME.equals(name) )
			return new MultiaryAdditionFixer();
		else if( MultiaryMultiplicationFixer.NAME.equals(name) )
			return new MultiaryMultiplicationFixer();
		else if( LogSumExpFixer.NAME.equals(name) )
			return new LogSumExpFixer();
		throw new IllegalArgumentException("Unknown fixer: '" + name + "'.");
	}

	public FixerPipeline addFixer(ProblemFixer fixer) {
		_fixers.add(fixer);
		return this;
	}

	public List<ProblemFixer> getFixers() {
		return Collections.unmodifiableList(_fixers);
	}

	/**
	 * Runs all fixers in order. If any of them fails, the graph is
	 * invalidated and the error propagates; runtime errors other than
	 * {@link BMGCompilerException}s are wrapped into a
	 * {@link FixerContractException} naming the failed fixer.
	 *
	 * @return one report per fixer, in pipeline order
	 */
	public List<RewriteReport> run() {
		ArrayList<RewriteReport> reports = new ArrayList<RewriteReport>();
		ProblemFixer current = null;
		try {
			for( ProblemFixer fixer : _fixers ) {
				current = fixer;
				RewriteReport report = _rewriter.run(fixer);
				reports.add(report);
				if( LOG.isDebugEnabled() )
					LOG.debug(report.toString());
			}
		}
		catch(BMGCompilerException ex) {
			LOG.error("Rewrite pipeline aborted: " + ex.getMessage());
			_rewriter.getBuilder().getGraph().invalidate(ex);
			throw ex;
		}
		catch(RuntimeException ex) {
			FixerContractException wrapped = new FixerContractException(
				"Fixer " + current.getName() + " failed: " + ex, ex);
			LOG.error("Rewrite pipeline aborted: " + wrapped.getMessage());
			_rewriter.getBuilder().getGraph().invalidate(wrapped);
			throw wrapped;
		}
		return reports;
	}
}
