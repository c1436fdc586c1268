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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vertex of a Bean Machine Graph. Kind and payload are fixed at construction;
 * the operand list only changes through {@link BMGraph#replace(BNode, BNode)},
 * which keeps the graph's consumer index in sync.
 */
public abstract class BNode implements Comparable<BNode>
{
	//sequence number, unique within the owning graph
	private final long _ID;
	private final NodeKind _kind;
	//operands, in order
	private final ArrayList<BNode> _inputs;

	protected BNode(long id, NodeKind kind, List<BNode> inputs) {
		_ID = id;
		_kind = kind;
		_inputs = new ArrayList<BNode>(inputs);
	}

	public long getID() {
		return _ID;
	}

	public NodeKind getKind() {
		return _kind;
	}

	public boolean isKind(NodeKind kind) {
		return _kind == kind;
	}

	public List<BNode> getInput() {
		return Collections.unmodifiableList(_inputs);
	}

	public BNode getInput(int pos) {
		return _inputs.get(pos);
	}

	public int getNumInputs() {
		return _inputs.size();
	}

	public boolean hasInput(BNode node) {
		return _inputs.contains(node);
	}

	/**
	 * Structural key used for interning: kind, operand ids in order and the
	 * payload of the concrete node type.
	 */
	public String getStructureKey() {
		return getStructureKey(_kind, _inputs, getPayload());
	}

	public static String getStructureKey(NodeKind kind, List<BNode> inputs, String payload) {
		StringBuilder sb = new StringBuilder(kind.name());
		sb.append('(');
		for( int i=0; i<inputs.size(); i++ ) {
			if( i > 0 )
				sb.append(',');
			sb.append(inputs.get(i).getID());
		}
		sb.append(')');
		if( payload != null )
			sb.append('#').append(payload);
		return sb.toString();
	}

	/**
	 * @return the serialized payload of this node (e.g., a constant value), or
	 *         null if the node carries none
	 */
	public abstract String getPayload();

	//rewires every occurrence of inOld, returns the number of rewired positions
	int replaceInput(BNode inOld, BNode inNew) {
		int count = 0;
		for( int i=0; i<_inputs.size(); i++ )
			if( _inputs.get(i) == inOld ) {
				_inputs.set(i, inNew);
				count++;
			}
		return count;
	}

	void clearInputs() {
		_inputs.clear();
	}

	@Override
	public int compareTo(BNode that) {
		return Long.compare(_ID, that._ID);
	}

	@Override
	public String toString() {
		return _kind.getLabel() + "(" + _ID + ")";
	}
}
