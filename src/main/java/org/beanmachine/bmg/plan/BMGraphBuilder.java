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

package org.beanmachine.bmg.plan;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Factory for the nodes of one {@link BMGraph}. Structurally identical
 * deterministic nodes are created once and shared; samples, observations and
 * queries are always fresh.
 */
public class BMGraphBuilder
{
	private final BMGraph _graph;
	//structure key -> interned node
	private final HashMap<String, BNode> _memo;
	private int _numQueries;

	public BMGraphBuilder() {
		this(new BMGraph());
	}

	public BMGraphBuilder(BMGraph graph) {
		_graph = graph;
		_memo = new HashMap<String, BNode>();
		_numQueries = 0;
	}

	public BMGraph getGraph() {
		return _graph;
	}

	public BNodeConstant addConstant(double value) {
		String key = BNode.getStructureKey(NodeKind.CONSTANT,
			Collections.<BNode>emptyList(), Double.toString(value));
		BNode found = lookup(key);
		if( found != null )
			return (BNodeConstant) found;
		BNodeConstant node = new BNodeConstant(_graph.nextID(), value);
		register(node);
		return node;
	}

	public BNode addNormal(BNode mu, BNode sigma) {
		return addNode(NodeKind.NORMAL, mu, sigma);
	}

	public BNode addBeta(BNode alpha, BNode beta) {
		return addNode(NodeKind.BETA, alpha, beta);
	}

	public BNode addBernoulli(BNode probability) {
		return addNode(NodeKind.BERNOULLI, probability);
	}

	public BNode addGamma(BNode concentration, BNode rate) {
		return addNode(NodeKind.GAMMA, concentration, rate);
	}

	public BNode addSample(BNode distribution) {
		Preconditions.checkArgument(distribution.getKind().isDistribution(),
			"Cannot sample from non-distribution %s.", distribution);
		return addNode(NodeKind.SAMPLE, distribution);
	}

	/**
	 * Adds an observation of the given sample and registers it as root.
	 */
	public BNode addObservation(BNode sample, double value) {
		Preconditions.checkArgument(sample.isKind(NodeKind.SAMPLE),
			"Only samples can be observed, got %s.", sample);
		BNode node = addNode(NodeKind.OBSERVE, sample, addConstant(value));
		_graph.addRoot(node);
		return node;
	}

	/**
	 * Adds a query of the given node and registers it as root.
	 */
	public BNodeQuery addQuery(BNode operand) {
		checkInputs(NodeKind.QUERY, Arrays.asList(operand));
		BNodeQuery node = new BNodeQuery(_graph.nextID(), _numQueries++, operand);
		_graph.add(node);
		_graph.addRoot(node);
		return node;
	}

	public BNode addAddition(BNode left, BNode right) {
		return addNode(NodeKind.ADDITION, left, right);
	}

	public BNode addMultiAddition(BNode... operands) {
		return addNode(NodeKind.MULTI_ADDITION, operands);
	}

	public BNode addMultiAddition(List<BNode> operands) {
		return addNode(NodeKind.MULTI_ADDITION, operands);
	}

	public BNode addMultiplication(BNode left, BNode right) {
		return addNode(NodeKind.MULTIPLICATION, left, right);
	}

	public BNode addMultiMultiplication(BNode... operands) {
		return addNode(NodeKind.MULTI_MULTIPLICATION, operands);
	}

	public BNode addMultiMultiplication(List<BNode> operands) {
		return addNode(NodeKind.MULTI_MULTIPLICATION, operands);
	}

	public BNode addNegate(BNode operand) {
		return addNode(NodeKind.NEGATE, operand);
	}

	public BNode addComplement(BNode operand) {
		return addNode(NodeKind.COMPLEMENT, operand);
	}

	public BNode addExp(BNode operand) {
		return addNode(NodeKind.EXP, operand);
	}

	public BNode addLog(BNode operand) {
		return addNode(NodeKind.LOG, operand);
	}

	public BNode addLogSumExp(BNode... operands) {
		return addNode(NodeKind.LOGSUMEXP, operands);
	}

	public BNode addLogSumExp(List<BNode> operands) {
		return addNode(NodeKind.LOGSUMEXP, operands);
	}

	public BNode addNode(NodeKind kind, BNode... inputs) {
		return addNode(kind, Arrays.asList(inputs));
	}

	/**
	 * Generic operator factory; constants and queries have dedicated
	 * factories since they carry a payload.
	 */
	public BNode addNode(NodeKind kind, List<BNode> inputs) {
		Preconditions.checkArgument(kind != NodeKind.CONSTANT && kind != NodeKind.QUERY,
			"Use the dedicated factory for %s nodes.", kind);
		checkInputs(kind, inputs);

		if( kind.isInterned() ) {
			BNode found = lookup(BNode.getStructureKey(kind, inputs, null));
			if( found != null )
				return found;
		}
		BNodeOperator node = new BNodeOperator(_graph.nextID(), kind, inputs);
		register(node);
		return node;
	}

	/**
	 * Adds a node with an externally assigned id, as used when reading
	 * serialized graphs. No interning takes place.
	 */
	public BNode addNodeWithID(long id, NodeKind kind, List<BNode> inputs, String payload) {
		checkInputs(kind, inputs);
		BNode node;
		switch( kind ) {
			case CONSTANT:
				node = new BNodeConstant(id, Double.parseDouble(payload));
				break;
			case QUERY:
				node = new BNodeQuery(id, Integer.parseInt(payload), inputs.get(0));
				_numQueries = Math.max(_numQueries, ((BNodeQuery)node).getQueryIndex() + 1);
				break;
			default:
				node = new BNodeOperator(id, kind, inputs);
		}
		_graph.reserveID(id);
		register(node);
		return node;
	}

	private void checkInputs(NodeKind kind, List<BNode> inputs) {
		Preconditions.checkArgument(kind.acceptsArity(inputs.size()),
			"Incorrect number of inputs for %s: %s.", kind, inputs.size());
		for( BNode input : inputs )
			Preconditions.checkArgument(_graph.contains(input),
				"Reference to node %s which is not part of this graph.", input);
	}

	//interned entries go stale once a node is removed or its operands rewired
	private BNode lookup(String key) {
		BNode found = _memo.get(key);
		if( found != null && _graph.contains(found) && found.getStructureKey().equals(key) )
			return found;
		return null;
	}

	private void register(BNode node) {
		_graph.add(node);
		if( node.getKind().isInterned() )
			_memo.put(node.getStructureKey(), node);
	}
}
