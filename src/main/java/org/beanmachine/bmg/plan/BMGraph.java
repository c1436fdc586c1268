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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.beanmachine.bmg.FixerContractException;
import org.beanmachine.bmg.utils.IDSequence;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Arena of the nodes of one model together with the designated roots
 * (observations and queries) and the reverse index from each node to the
 * nodes consuming it. The reverse index is the exact inverse of the operand
 * relation after every public operation.
 *
 * A graph is single-threaded and exclusively owned by one compilation.
 */
public class BMGraph
{
	private static final Log LOG = LogFactory.getLog(BMGraph.class.getName());

	private final IDSequence _idSeq;
	//all live nodes, by id
	private final TreeMap<Long, BNode> _nodes;
	//consumers per live node, ordered by id
	private final HashMap<BNode, TreeSet<BNode>> _consumers;
	private final ArrayList<BNode> _roots;
	private final ArrayList<GraphChangeListener> _listeners;
	//set once a rewrite failed fatally
	private Throwable _invalidCause;

	public BMGraph() {
		_idSeq = new IDSequence();
		_nodes = new TreeMap<Long, BNode>();
		_consumers = new HashMap<BNode, TreeSet<BNode>>();
		_roots = new ArrayList<BNode>();
		_listeners = new ArrayList<GraphChangeListener>();
	}

	long nextID() {
		return _idSeq.getNextID();
	}

	void reserveID(long id) {
		_idSeq.advanceTo(id);
	}

	/**
	 * Registers a freshly constructed node. All its operands must already be
	 * part of this graph, which rules out cycles by construction.
	 */
	void add(BNode node) {
		checkValid();
		Preconditions.checkArgument(!_nodes.containsKey(node.getID()),
			"Duplicate node id %s.", node.getID());
		for( BNode input : node.getInput() )
			Preconditions.checkArgument(contains(input),
				"Input %s of %s is not part of this graph.", input, node);

		_nodes.put(node.getID(), node);
		_consumers.put(node, new TreeSet<BNode>());
		for( BNode input : node.getInput() )
			_consumers.get(input).add(node);
	}

	public void addRoot(BNode node) {
		checkValid();
		Preconditions.checkArgument(contains(node), "Root %s is not part of this graph.", node);
		if( !_roots.contains(node) )
			_roots.add(node);
	}

	public List<BNode> getRoots() {
		checkValid();
		return Collections.unmodifiableList(_roots);
	}

	public boolean isRoot(BNode node) {
		checkValid();
		return _roots.contains(node);
	}

	public boolean contains(BNode node) {
		checkValid();
		return node != null && _nodes.get(node.getID()) == node;
	}

	public BNode getNode(long id) {
		checkValid();
		return _nodes.get(id);
	}

	public int size() {
		checkValid();
		return _nodes.size();
	}

	/**
	 * @return all live nodes in id order, including nodes that are not
	 *         (yet) reachable from a root
	 */
	public List<BNode> getNodes() {
		checkValid();
		return ImmutableList.copyOf(_nodes.values());
	}

	public SortedSet<BNode> getConsumers(BNode node) {
		checkValid();
		checkMember(node);
		return Collections.unmodifiableSortedSet(_consumers.get(node));
	}

	/**
	 * @return number of consumers, counting root status as one more use
	 */
	public int getOutDegree(BNode node) {
		checkValid();
		return getConsumers(node).size() + (isRoot(node) ? 1 : 0);
	}

	public void addListener(GraphChangeListener listener) {
		if( !_listeners.contains(listener) )
			_listeners.add(listener);
	}

	public void removeListener(GraphChangeListener listener) {
		_listeners.remove(listener);
	}

	/**
	 * All nodes reachable from the roots, operands before consumers. The order
	 * is a depth-first post-order over the roots in root order and over the
	 * operands in operand order, hence identical for identically built graphs.
	 *
	 * @return immutable snapshot of the current order
	 */
	public List<BNode> topologicalOrder() {
		checkValid();
		ArrayList<BNode> order = new ArrayList<BNode>();
		HashSet<BNode> visited = new HashSet<BNode>();
		//explicit stack of nodes and their next operand position
		Deque<BNode> stack = new ArrayDeque<BNode>();
		Deque<Integer> positions = new ArrayDeque<Integer>();
		for( BNode root : _roots ) {
			if( !visited.add(root) )
				continue;
			stack.push(root);
			positions.push(0);
			while( !stack.isEmpty() ) {
				BNode current = stack.peek();
				int pos = positions.pop();
				if( pos < current.getNumInputs() ) {
					positions.push(pos + 1);
					BNode input = current.getInput(pos);
					if( visited.add(input) ) {
						stack.push(input);
						positions.push(0);
					}
				}
				else {
					stack.pop();
					order.add(current);
				}
			}
		}
		return ImmutableList.copyOf(order);
	}

	/**
	 * @return true if target is reachable from node through operand edges
	 *         (a node depends on itself)
	 */
	public boolean dependsOn(BNode node, BNode target) {
		checkValid();
		HashSet<BNode> visited = new HashSet<BNode>();
		Deque<BNode> stack = new ArrayDeque<BNode>();
		stack.push(node);
		while( !stack.isEmpty() ) {
			BNode current = stack.pop();
			if( current == target )
				return true;
			if( visited.add(current) )
				for( BNode input : current.getInput() )
					stack.push(input);
		}
		return false;
	}

	/**
	 * Replaces hold by hnew everywhere hold is used: every consumer of hold
	 * now references hnew at the same operand positions, and hnew takes over
	 * hold's root position. Afterwards hold and every node that only served
	 * it are removed from the graph.
	 *
	 * @param hold node to replace
	 * @param hnew replacement node, must not depend on hold
	 * @throws FixerContractException if either node is foreign to this graph
	 *         or the replacement would introduce a cycle
	 */
	public void replace(BNode hold, BNode hnew) {
		checkValid();
		if( !contains(hold) || !contains(hnew) ) {
			throw new FixerContractException("Cannot replace " + hold + " by " + hnew
				+ ": both nodes must be part of the graph.");
		}
		if( hold == hnew )
			return;
		if( dependsOn(hnew, hold) ) {
			throw new FixerContractException("Replacing " + hold + " by " + hnew
				+ " would introduce a cycle.");
		}

		//rewire consumers (snapshot, since the index changes underneath)
		ArrayList<BNode> rewired = new ArrayList<BNode>(_consumers.get(hold));
		TreeSet<BNode> newConsumers = _consumers.get(hnew);
		for( BNode consumer : rewired ) {
			consumer.replaceInput(hold, hnew);
			newConsumers.add(consumer);
		}
		_consumers.get(hold).clear();

		//transfer root status
		int rootPos = _roots.indexOf(hold);
		if( rootPos >= 0 ) {
			if( _roots.contains(hnew) )
				_roots.remove(rootPos);
			else
				_roots.set(rootPos, hnew);
		}

		if( LOG.isTraceEnabled() )
			LOG.trace("Replaced " + hold + " by " + hnew + " in " + rewired.size() + " consumers.");

		for( GraphChangeListener listener : new ArrayList<GraphChangeListener>(_listeners) )
			listener.nodeReplaced(hold, hnew, Collections.unmodifiableList(rewired));

		cleanupUnreferenced(hold);
	}

	/**
	 * Removes the given node if it is neither a root nor used by any node,
	 * and cascades to its operands.
	 *
	 * @return number of removed nodes
	 */
	public int cleanupUnreferenced(BNode node) {
		checkValid();
		int removed = 0;
		Deque<BNode> worklist = new ArrayDeque<BNode>();
		worklist.push(node);
		while( !worklist.isEmpty() ) {
			BNode current = worklist.pop();
			if( !contains(current) || isRoot(current) || !_consumers.get(current).isEmpty() )
				continue;

			LinkedHashSet<BNode> inputs = new LinkedHashSet<BNode>(current.getInput());
			for( BNode input : inputs ) {
				_consumers.get(input).remove(current);
				worklist.push(input);
			}
			current.clearInputs();
			_nodes.remove(current.getID());
			_consumers.remove(current);
			removed++;

			for( GraphChangeListener listener : new ArrayList<GraphChangeListener>(_listeners) )
				listener.nodeRemoved(current);
		}
		return removed;
	}

	/**
	 * Marks this graph as unusable after a fatal error during rewriting.
	 * Every later access raises an {@link IllegalStateException}.
	 */
	public void invalidate(Throwable cause) {
		_invalidCause = cause;
	}

	public boolean isValid() {
		return _invalidCause == null;
	}

	private void checkValid() {
		if( _invalidCause != null )
			throw new IllegalStateException("Graph was invalidated by a failed rewrite.", _invalidCause);
	}

	private void checkMember(BNode node) {
		Preconditions.checkArgument(contains(node), "Node %s is not part of this graph.", node);
	}
}
