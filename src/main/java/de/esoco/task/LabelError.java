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
 * Signals a defect in the wiring of a task's state machine, e.g. a jump to a
 * label that has not been allocated or has no code, or the access to a {@link
 * TaskStep} value that doesn't match the step type. This is an {@link Error}
 * because it is not recoverable: it must never be handled by the exception
 * handler of a try-with block.
 *
 * @author eso
 */
public class LabelError extends Error
{
	//~ Static fields/initializers ---------------------------------------------

	private static final long serialVersionUID = 1L;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance.
	 *
	 * @param sMessage The error message
	 */
	public LabelError(String sMessage)
	{
		super(sMessage);
	}
}
