//++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++
// This file is a part of the 'task-builder' project.
// Copyright 2018 Elmar Sonnenschein, esoco GmbH, Flensburg, Germany
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//	  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++
package de.esoco.task;

/********************************************************************
 * An unchecked exception for failures of the task machinery itself, e.g. the
 * violation of the awaiter protocol. It is also used to wrap throwables that
 * are neither exceptions nor errors so that they can be rethrown from task
 * code.
 *
 * @author eso
 */
public class TaskException extends RuntimeException
{
	//~ Static fields/initializers ---------------------------------------------

	private static final long serialVersionUID = 1L;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance with a message.
	 *
	 * @param sMessage The error message
	 */
	public TaskException(String sMessage)
	{
		super(sMessage);
	}

	/***************************************
	 * Creates a new instance with a causing exception.
	 *
	 * @param eCause The causing exception
	 */
	public TaskException(Throwable eCause)
	{
		super(eCause);
	}
}
