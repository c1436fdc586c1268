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

import java.io.IOException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Process-wide access to the active {@link CompilerConfig}. The config is
 * loaded from the classpath on first access unless one was set explicitly.
 */
public class ConfigurationManager
{
	private static final Log LOG = LogFactory.getLog(ConfigurationManager.class.getName());

	private static CompilerConfig _cconf = null;

	public synchronized static CompilerConfig getCompilerConfig() {
		if( _cconf == null ) {
			try {
				_cconf = CompilerConfig.load();
			}
			catch(IOException ex) {
				throw new IllegalStateException("Failed to read " + CompilerConfig.DEFAULT_RESOURCE + ".", ex);
			}
			LOG.debug("Loaded " + _cconf);
		}
		return _cconf;
	}

	public synchronized static void setCompilerConfig(CompilerConfig conf) {
		_cconf = conf;
	}

	/**
	 * Drops the active config, the next access reloads it.
	 */
	public synchronized static void reset() {
		_cconf = null;
	}

	public static boolean isExplainEnabled() {
		return getCompilerConfig().isExplainEnabled();
	}

	public static int getPassCeiling(int graphSize) {
		return getCompilerConfig().getPassCeiling(graphSize);
	}
}
