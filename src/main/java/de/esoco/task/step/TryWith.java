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
import de.esoco.task.await.Awaitables;
import de.esoco.task.await.Awaiter;


/********************************************************************
 * Protects code with an exception handler. The handler is invoked for
 * exceptions that occur when the code is executed initially, after any of it's
 * suspensions has been resumed, and for the failure of a future the code hands
 * off it's result to. A failed awaited future is therefore handled exactly
 * like a synchronously thrown exception. Errors are not handled.
 *
 * <p>Only a single handler is supported. Matching of different exception types
 * needs to be done by the handler.</p>
 *
 * @author eso
 */
public class TryWith<T>
{
	//~ Instance fields --------------------------------------------------------

	private final LabelTable						 rLabels;
	private final StepFunction<? super Exception, T> fCatch;
	private final int								 nEntry;

	private int nInnerEntry;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance and installs it's labels.
	 *
	 * @param rLabels The label table of the task
	 * @param fCode   The protected code
	 * @param fCatch  The exception handler
	 */
	private TryWith(LabelTable						   rLabels,
					StepCode<T>						   fCode,
					StepFunction<? super Exception, T> fCatch)
	{
		this.rLabels = rLabels;
		this.fCatch  = fCatch;

		nInnerEntry = rLabels.code(fCode);
		nEntry	    = rLabels.code(this::enter);
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Executes code and handles it's exceptions.
	 *
	 * @param  rLabels The label table of the task
	 * @param  fCode   The code to execute
	 * @param  fCatch  The exception handler
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the exception handler fails
	 */
	public static <T> TaskStep<T> tryWith(
		LabelTable						   rLabels,
		StepCode<T>						   fCode,
		StepFunction<? super Exception, T> fCatch) throws Exception
	{
		return rLabels.jump(new TryWith<>(rLabels, fCode, fCatch).nEntry);
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * The code of the entry label that executes the protected code from the
	 * current inner entry.
	 *
	 * @return The next step
	 *
	 * @throws Exception If the exception handler fails
	 */
	private TaskStep<T> enter() throws Exception
	{
		TaskStep<T> rStep;

		try
		{
			rStep = rLabels.jump(nInnerEntry);
		}
		catch (Exception e)
		{
			return fCatch.apply(e);
		}

		if (rStep.isReturn())
		{
			return rStep;
		}
		else if (rStep.isReturnFrom())
		{
			Awaiter<T> rAwaiter =
				Awaitables.of(rStep.getNextTask()).getAwaiter();

			return Bind.continueWith(
				rLabels,
				rAwaiter,
				() ->
				{
					T rResult;

					try
					{
						rResult = rAwaiter.getResult();
					}
					catch (Exception e)
					{
						return fCatch.apply(e);
					}

					return TaskStep.returnValue(rResult);
				});
		}
		else
		{
			int nResume = rStep.getResumeLabel();

			// resume through the entry label to stay inside the handler scope
			return TaskStep.await(
				rStep.getAwaiter(),
				rLabels.code(
					() ->
					{
						nInnerEntry = nResume;

						return rLabels.jump(nEntry);
					}));
		}
	}
}
