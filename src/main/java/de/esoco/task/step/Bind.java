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

import de.esoco.task.LabelTable;
import de.esoco.task.StepCode;
import de.esoco.task.StepFunction;
import de.esoco.task.TaskStep;
import de.esoco.task.await.Awaitable;
import de.esoco.task.await.Awaiter;
import de.esoco.task.await.ConfigurableAwaitable;


/********************************************************************
 * Converts {@link Awaitable} instances into task steps. If the awaited result
 * is already available the continuation is invoked immediately on the current
 * stack. Otherwise an await step is returned that resumes at a label which
 * retrieves the result and invokes the continuation.
 *
 * <p>Chains of synchronously completed awaits are executed recursively on the
 * calling stack, so very long chains of them will increase the stack depth
 * accordingly.</p>
 *
 * @author eso
 */
public class Bind
{
	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Private, only static use.
	 */
	private Bind()
	{
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Awaits the result of an awaitable and then continues with a function
	 * that receives the result. The resumption context is determined by the
	 * awaitable.
	 *
	 * @param  rLabels       The label table of the task
	 * @param  rAwaitable    The awaitable
	 * @param  fContinuation The continuation to invoke with the result
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If a synchronous continuation fails
	 */
	public static <T1, T2> TaskStep<T2> bind(
		LabelTable						rLabels,
		Awaitable<T1>					rAwaitable,
		StepFunction<? super T1, T2>	fContinuation) throws Exception
	{
		Awaiter<T1> rAwaiter = rAwaitable.getAwaiter();

		return continueWith(
			rLabels,
			rAwaiter,
			() -> fContinuation.apply(rAwaiter.getResult()));
	}

	/***************************************
	 * A variant of {@link #bind(LabelTable, Awaitable, StepFunction)} that
	 * doesn't resume in the originating context.
	 *
	 * @see #bind(LabelTable, Awaitable, StepFunction)
	 */
	public static <T1, T2> TaskStep<T2> bindConfigureFalse(
		LabelTable						rLabels,
		ConfigurableAwaitable<T1>		rAwaitable,
		StepFunction<? super T1, T2>	fContinuation) throws Exception
	{
		return bind(rLabels, rAwaitable.configureAwait(false), fContinuation);
	}

	/***************************************
	 * Continues with certain code after an awaiter has completed. The code is
	 * installed at a new label. If the awaiter has completed already the label
	 * will be executed directly, else an await step for it will be returned.
	 *
	 * @param  rLabels   The label table of the task
	 * @param  rAwaiter  The awaiter
	 * @param  fContinue The code to execute after completion
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the code is executed directly and fails
	 */
	public static <T> TaskStep<T> continueWith(LabelTable  rLabels,
											   Awaiter<?>  rAwaiter,
											   StepCode<T> fContinue)
		throws Exception
	{
		int nContinue = rLabels.code(fContinue);

		if (rAwaiter.isCompleted())
		{
			return rLabels.jump(nContinue);
		}
		else
		{
			return TaskStep.await(rAwaiter, nContinue);
		}
	}

	/***************************************
	 * Awaits an awaitable and returns it's result as the task result.
	 *
	 * @param  rLabels    The label table of the task
	 * @param  rAwaitable The awaitable to return the result of
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the awaitable has failed already
	 */
	public static <T> TaskStep<T> returnFromAwaitable(
		LabelTable    rLabels,
		Awaitable<T> rAwaitable) throws Exception
	{
		return bind(rLabels, rAwaitable, TaskStep::returnValue);
	}
}
