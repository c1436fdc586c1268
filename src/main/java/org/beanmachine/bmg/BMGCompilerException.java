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

/**
 * Base class of all fatal compiler errors. A graph on which one of these was
 * raised during rewriting is not handed back to the caller.
 */
public class BMGCompilerException extends RuntimeException
{
	private static final long serialVersionUID = 3921583066071446121L;

	public BMGCompilerException(String message) {
		super(message);
	}

	public BMGCompilerException(String message, Throwable cause) {
		super(message, cause);
	}
}
