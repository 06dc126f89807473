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
 * A continuation that produces the next {@link TaskStep} of a task. This is
 * the type of the code that is stored under a label in a {@link LabelTable}.
 * Like synchronous code it may throw any exception which will then be handled
 * by an enclosing try-with or try-finally or fail the task.
 *
 * @author eso
 */
@FunctionalInterface
public interface StepCode<T>
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Executes the code up to the next step.
	 *
	 * @return The resulting step
	 *
	 * @throws Exception Any exception raised by the code
	 */
	public TaskStep<T> execute() throws Exception;
}
