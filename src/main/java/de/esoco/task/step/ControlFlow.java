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
package de.esoco.task.step;

import de.esoco.task.TaskStep;

import java.util.concurrent.CompletableFuture;


/********************************************************************
 * The terminal control flow steps of tasks. The combinators that compose steps
 * are implemented in separate classes like {@link Combine}, {@link WhileLoop},
 * or {@link TryFinally}.
 *
 * @author eso
 */
public class ControlFlow
{
	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Private, only static use.
	 */
	private ControlFlow()
	{
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Returns a value as the result of a task.
	 *
	 * @param  rValue The result value
	 *
	 * @return A return step
	 */
	public static <T> TaskStep<T> ret(T rValue)
	{
		return TaskStep.returnValue(rValue);
	}

	/***************************************
	 * Hands off the result of a task to another future. Nothing may follow
	 * this step.
	 *
	 * @param  fTask The future to return the result from
	 *
	 * @return A return-from step
	 */
	public static <T> TaskStep<T> returnFrom(CompletableFuture<T> fTask)
	{
		return TaskStep.returnFrom(fTask);
	}

	/***************************************
	 * Returns a step without a result. This represents no-ops like an empty
	 * else branch.
	 *
	 * @return A return step with a NULL value
	 */
	public static TaskStep<Void> zero()
	{
		return TaskStep.returnValue(null);
	}
}
