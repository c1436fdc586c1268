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

package org.beanmachine.bmg.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.beanmachine.bmg.GraphFormatException;
import org.beanmachine.bmg.plan.BMGraph;
import org.beanmachine.bmg.plan.BMGraphBuilder;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.NodeKind;

/**
 * Line-based serialization of graphs. Nodes are written in child-first
 * topological order, one per line:
 *
 * <pre>id;KIND;input ids;payload;root position</pre>
 *
 * e.g., <code>4;LOG;3;;</code> or <code>7;QUERY;6;0;0</code>. Only nodes
 * reachable from the roots are written. Node ids are preserved on read.
 */
public class GraphSerde
{
	private static final Log LOG = LogFactory.getLog(GraphSerde.class.getName());

	private static final int NUM_ATTRIBUTES = 5;

	/**
	 * Serialize a graph into child-first topological order.
	 *
	 * @param graph graph to serialize
	 * @return one line per reachable node
	 */
	public static String serialize(BMGraph graph) {
		StringBuilder sb = new StringBuilder();
		List<BNode> roots = graph.getRoots();
		for( BNode node : graph.topologicalOrder() )
			sb.append(serializeNode(node, roots.indexOf(node))).append('\n');
		return sb.toString();
	}

	private static String serializeNode(BNode node, int rootPos) {
		StringBuilder sb = new StringBuilder();

		// Node ID
		sb.append(node.getID()).append(';');

		// Kind
		sb.append(node.getKind().name()).append(';');

		// Input ID(s)
		ArrayList<Long> inputs = new ArrayList<Long>();
		for( BNode input : node.getInput() )
			inputs.add(input.getID());
		sb.append(StringUtils.join(inputs, ',')).append(';');

		// Payload (if applicable)
		if( node.getPayload() != null )
			sb.append(node.getPayload());
		sb.append(';');

		// Root position (if applicable)
		if( rootPos >= 0 )
			sb.append(rootPos);

		return sb.toString();
	}

	public static void writeGraph(BMGraph graph, File file) throws IOException {
		Files.deleteIfExists(file.toPath());
		try( BufferedWriter writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8) ) {
			writer.append(serialize(graph));
		}
		if( LOG.isDebugEnabled() )
			LOG.debug("Wrote " + graph.size() + " nodes to " + file + ".");
	}

	public static BMGraphBuilder readGraph(File file) throws IOException {
		List<String> lines = new ArrayList<String>();
		try( BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8) ) {
			String line;
			while( (line = reader.readLine()) != null )
				lines.add(line);
		}
		try {
			return deserialize(lines);
		}
		catch(GraphFormatException ex) {
			throw new GraphFormatException("Failed to parse graph file " + file + ": " + ex.getMessage(), ex);
		}
	}

	public static BMGraphBuilder deserialize(String graphString) {
		return deserialize(Arrays.asList(graphString.split("\n")));
	}

	/**
	 * Deserialize a list of strings representing a graph. Assumes child-first
	 * topological order; blank lines are ignored.
	 *
	 * @param lines serialized nodes
	 * @return builder of a fresh graph holding the deserialized nodes
	 * @throws GraphFormatException for malformed lines, unknown kinds,
	 *         references to undefined nodes and duplicate ids
	 */
	public static BMGraphBuilder deserialize(List<String> lines) {
		BMGraphBuilder bmg = new BMGraphBuilder();
		Map<Long, BNode> nodes = new HashMap<Long, BNode>();
		TreeMap<Integer, BNode> roots = new TreeMap<Integer, BNode>();

		for( int i=0; i<lines.size(); i++ ) {
			String line = lines.get(i).trim();
			if( line.isEmpty() )
				continue;
			try {
				deserializeNode(line, bmg, nodes, roots);
			}
			catch(GraphFormatException ex) {
				throw new GraphFormatException("Line " + (i+1) + ": " + ex.getMessage(), ex);
			}
		}

		for( BNode root : roots.values() )
			bmg.getGraph().addRoot(root);
		return bmg;
	}

	private static void deserializeNode(String line, BMGraphBuilder bmg,
		Map<Long, BNode> nodes, Map<Integer, BNode> roots)
	{
		String[] attributes = line.split(";", -1);
		if( attributes.length != NUM_ATTRIBUTES )
			throw new GraphFormatException("Expected " + NUM_ATTRIBUTES
				+ " attributes but found " + attributes.length + ": " + line);

		long id = parseLong(attributes[0], "node id");
		if( nodes.containsKey(id) )
			throw new GraphFormatException("Duplicate node id " + id + ".");

		if( !NodeKind.contains(attributes[1]) )
			throw new GraphFormatException("Cannot recognize node kind: " + attributes[1]);
		NodeKind kind = NodeKind.valueOf(attributes[1]);

		List<BNode> inputs = new ArrayList<BNode>();
		for( String idString : StringUtils.split(attributes[2], ',') ) {
			long inputID = parseLong(idString, "input id");
			BNode input = nodes.get(inputID);
			if( input == null )
				throw new GraphFormatException("Reference to node " + inputID
					+ " which is not defined before node " + id + ".");
			inputs.add(input);
		}
		if( !kind.acceptsArity(inputs.size()) )
			throw new GraphFormatException("Incorrect number of inputs for " + kind + ": " + inputs.size());

		String payload = StringUtils.isEmpty(attributes[3]) ? null : attributes[3];
		if( (kind == NodeKind.CONSTANT || kind == NodeKind.QUERY) && payload == null )
			throw new GraphFormatException("Missing value for " + kind + " node " + id + ".");

		BNode node;
		try {
			node = bmg.addNodeWithID(id, kind, inputs, payload);
		}
		catch(IllegalArgumentException ex) {
			throw new GraphFormatException("Invalid node " + id + ": " + ex.getMessage(), ex);
		}
		nodes.put(id, node);

		if( !StringUtils.isEmpty(attributes[4]) ) {
			int rootPos = (int) parseLong(attributes[4], "root position");
			if( roots.put(rootPos, node) != null )
				throw new GraphFormatException("Duplicate root position " + rootPos + ".");
		}
	}

	private static long parseLong(String value, String what) {
		try {
			return Long.parseLong(value.trim());
		}
		catch(NumberFormatException ex) {
			throw new GraphFormatException("Invalid " + what + ": '" + value + "'.", ex);
		}
	}
}
