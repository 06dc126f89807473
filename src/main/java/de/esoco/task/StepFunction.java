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
 * A continuation that receives an input value and produces the next {@link
 * TaskStep}. Used for the continuations of awaits, the bodies of for-loops and
 * using blocks, and for exception handlers.
 *
 * @author eso
 */
@FunctionalInterface
public interface StepFunction<I, T>
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Applies this function to an input value.
	 *
	 * @param  rInput The input value
	 *
	 * @return The resulting step
	 *
	 * @throws Exception Any exception raised by the code
	 */
	public TaskStep<T> apply(I rInput) throws Exception;
}
