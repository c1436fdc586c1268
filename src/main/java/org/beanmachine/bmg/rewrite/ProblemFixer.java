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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.types.BMGLatticeType;
import org.beanmachine.bmg.types.LatticeTyper;
import org.beanmachine.bmg.types.UntypableNodeException;

/**
 * Base class of all graph fixers. A fixer detects one local pattern and
 * builds a semantically equivalent replacement for the matched node; the
 * repeated application over the whole graph is driven by a
 * {@link FixpointRewriter}.
 *
 * Fixers must not keep state about the graph between calls. Every
 * replacement has to strictly decrease some well-founded measure of the
 * graph (e.g., the number of nodes of a certain kind), otherwise the
 * rewriter cannot reach a fixpoint.
 */
public abstract class ProblemFixer
{
	protected static final Log LOG = LogFactory.getLog(ProblemFixer.class.getName());

	/**
	 * @return name used in reports, logs and the configured fixer list
	 */
	public abstract String getName();

	/**
	 * @return true if the rewriter repeats passes until no node needs fixing,
	 *         false for a single pass
	 */
	public boolean isRunToFixpoint() {
		return true;
	}

	/**
	 * Pattern test against the current state of the graph.
	 */
	public abstract boolean needsFixing(BNode node, BMGraphBuilder bmg, LatticeTyper typer);

	/**
	 * Builds the replacement for a node for which {@link #needsFixing} just
	 * returned true; the graph has not changed in between.
	 *
	 * @return the replacement node, or null if none can be built
	 */
	public abstract BNode getReplacement(BNode node, BMGraphBuilder bmg, LatticeTyper typer);

	/**
	 * Queries the typer for fixers whose patterns depend on operand types.
	 *
	 * @return the type of the node, or null if the node cannot be typed, in
	 *         which case the pattern is treated as not applicable
	 */
	protected BMGLatticeType tryTypeOf(LatticeTyper typer, BNode node) {
		try {
			return typer.typeOf(node);
		}
		catch(UntypableNodeException ex) {
			if( LOG.isDebugEnabled() )
				LOG.debug(getName() + ": skipping untypable " + node + " (" + ex.getMessage() + ").");
			return null;
		}
	}

	@Override
	public String toString() {
		return getName();
	}
}
