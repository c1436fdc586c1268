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

package org.beanmachine.bmg;

import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.beanmachine.bmg.conf.CompilerConfig;
import org.beanmachine.bmg.conf.ConfigurationManager;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.rewrite.FixerPipeline;
import org.beanmachine.bmg.rewrite.RewriteReport;
import org.beanmachine.bmg.types.LatticeTyper;
import org.beanmachine.bmg.utils.Explain;

/**
 * Entry point of the graph compiler: normalizes a model graph in place by
 * running the configured fixer pipeline over it.
 */
public class BMGCompiler
{
	private static final Log LOG = LogFactory.getLog(BMGCompiler.class.getName());

	//internal configuration flags
	public static boolean LDEBUG = false;

	static {
		// for internal debugging only
		if( LDEBUG ) {
			Logger.getLogger("org.beanmachine.bmg")
				  .setLevel(Level.TRACE);
		}
	}

	/**
	 * Main interface of the graph compiler, with the process-wide config.
	 *
	 * @param bmg builder of the graph to normalize
	 * @return one report per fixer, in pipeline order
	 * @throws BMGCompilerException if a fixer fails fatally; the graph is
	 *         unusable afterwards
	 */
	public static List<RewriteReport> optimize(BMGraphBuilder bmg) {
		return optimize(bmg, ConfigurationManager.getCompilerConfig());
	}

	public static List<RewriteReport> optimize(BMGraphBuilder bmg, CompilerConfig conf) {
		LatticeTyper typer = new LatticeTyper(bmg.getGraph());
		try {
			return optimize(bmg, typer, conf);
		}
		finally {
			bmg.getGraph().removeListener(typer);
		}
	}

	public static List<RewriteReport> optimize(BMGraphBuilder bmg, LatticeTyper typer, CompilerConfig conf) {
		boolean explain = conf.isExplainEnabled() && LOG.isTraceEnabled();
		if( explain ) {
			LOG.trace("BMGCompiler called for graph: \n"
				+ Explain.explainGraph(bmg.getGraph(), typer));
		}

		FixerPipeline pipeline = FixerPipeline.fromConfig(bmg, typer, conf);
		List<RewriteReport> reports = pipeline.run();

		if( explain ) {
			LOG.trace("Explain after graph rewriting: \n"
				+ Explain.explainGraph(bmg.getGraph(), typer));
		}
		if( LOG.isDebugEnabled() )
			LOG.debug("Rewrote graph with " + pipeline.getFixers().size()
				+ " fixers: " + reports);

		return reports;
	}
}
