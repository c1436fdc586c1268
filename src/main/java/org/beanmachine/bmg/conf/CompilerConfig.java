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

package org.beanmachine.bmg.conf;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Compiler settings, read from a properties file over built-in defaults.
 * Instances are immutable once loaded.
 */
public class CompilerConfig
{
	private static final Log LOG = LogFactory.getLog(CompilerConfig.class.getName());

	public static final String DEFAULT_RESOURCE = "bmg-compiler.properties";

	//configuration keys
	public static final String PASS_CEILING_MIN = "bmg.rewrite.pass.ceiling.min";
	public static final String PASS_CEILING_FACTOR = "bmg.rewrite.pass.ceiling.factor";
	public static final String FIXERS = "bmg.rewrite.fixers";
	public static final String EXPLAIN_ENABLED = "bmg.explain.enabled";

	private static final Properties DEFAULTS = new Properties();
	static {
		DEFAULTS.setProperty(PASS_CEILING_MIN, "16");
		DEFAULTS.setProperty(PASS_CEILING_FACTOR, "2");
		DEFAULTS.setProperty(FIXERS, "complement,multiary_addition,multiary_multiplication,logsumexp");
		DEFAULTS.setProperty(EXPLAIN_ENABLED, "false");
	}

	private final int _passCeilingMin;
	private final int _passCeilingFactor;
	private final List<String> _fixers;
	private final boolean _explainEnabled;

	public CompilerConfig() {
		this(new Properties());
	}

	public CompilerConfig(Properties props) {
		Properties merged = new Properties();
		merged.putAll(DEFAULTS);
		merged.putAll(props);

		_passCeilingMin = parsePositiveInt(merged, PASS_CEILING_MIN);
		_passCeilingFactor = parsePositiveInt(merged, PASS_CEILING_FACTOR);
		_explainEnabled = Boolean.parseBoolean(merged.getProperty(EXPLAIN_ENABLED).trim());
		_fixers = new ArrayList<String>();
		for( String name : StringUtils.split(merged.getProperty(FIXERS), ',') )
			if( !StringUtils.isBlank(name) )
				_fixers.add(name.trim().toLowerCase());
	}

	/**
	 * Loads the default resource from the classpath, falling back to the
	 * built-in defaults if it does not exist.
	 */
	public static CompilerConfig load() throws IOException {
		InputStream in = CompilerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if( in == null ) {
			LOG.debug("No " + DEFAULT_RESOURCE + " on classpath, using defaults.");
			return new CompilerConfig();
		}
		try {
			return load(in);
		}
		finally {
			in.close();
		}
	}

	public static CompilerConfig load(File file) throws IOException {
		try( InputStream in = new FileInputStream(file) ) {
			return load(in);
		}
	}

	public static CompilerConfig load(InputStream in) throws IOException {
		Properties props = new Properties();
		props.load(in);
		return new CompilerConfig(props);
	}

	public int getPassCeilingMin() {
		return _passCeilingMin;
	}

	public int getPassCeilingFactor() {
		return _passCeilingFactor;
	}

	/**
	 * @param graphSize number of nodes of the graph to rewrite
	 * @return maximum number of passes a single fixer may take
	 */
	public int getPassCeiling(int graphSize) {
		return Math.max(_passCeilingMin, _passCeilingFactor * graphSize + 1);
	}

	public List<String> getFixers() {
		return new ArrayList<String>(_fixers);
	}

	public boolean isExplainEnabled() {
		return _explainEnabled;
	}

	private static int parsePositiveInt(Properties props, String key) {
		String value = props.getProperty(key).trim();
		int ret;
		try {
			ret = Integer.parseInt(value);
		}
		catch(NumberFormatException ex) {
			throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'.", ex);
		}
		if( ret < 1 )
			throw new IllegalArgumentException("Value for " + key + " must be positive: " + ret + ".");
		return ret;
	}

	@Override
	public String toString() {
		return "CompilerConfig[" + PASS_CEILING_MIN + "=" + _passCeilingMin
			+ ", " + PASS_CEILING_FACTOR + "=" + _passCeilingFactor
			+ ", " + FIXERS + "=" + StringUtils.join(_fixers, ',')
			+ ", " + EXPLAIN_ENABLED + "=" + _explainEnabled + "]";
	}
}
