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

import de.esoco.task.Compensation;
import de.esoco.task.LabelTable;
import de.esoco.task.StepCode;
import de.esoco.task.TaskStep;
import de.esoco.task.await.Awaitables;
import de.esoco.task.await.Awaiter;


/********************************************************************
 * Protects code with a compensation that is executed exactly once after the
 * code has finished. This is the case if the code returns, throws an
 * exception, or if the future it hands off it's result to has completed. The
 * compensation is not executed while the code is only suspended.
 *
 * <p>The compensation always runs before a failure is propagated. If the
 * compensation itself fails it's exception is propagated and the original
 * failure (if any) is added to it as a suppressed exception.</p>
 *
 * @author eso
 */
public class TryFinally<T>
{
	//~ Instance fields --------------------------------------------------------

	private final LabelTable   rLabels;
	private final Compensation fCompensation;
	private final int		   nEntry;

	private int		nInnerEntry;
	private boolean bCompensated = false;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance and installs it's labels.
	 *
	 * @param rLabels       The label table of the task
	 * @param fCode         The protected code
	 * @param fCompensation The compensation
	 */
	private TryFinally(LabelTable   rLabels,
					   StepCode<T>  fCode,
					   Compensation fCompensation)
	{
		this.rLabels	   = rLabels;
		this.fCompensation = fCompensation;

		nInnerEntry = rLabels.code(fCode);
		nEntry	    = rLabels.code(this::enter);
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Executes code and a compensation after the code has finished.
	 *
	 * @param  rLabels       The label table of the task
	 * @param  fCode         The code to execute
	 * @param  fCompensation The compensation
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the code or the compensation fails
	 */
	public static <T> TaskStep<T> tryFinally(LabelTable   rLabels,
											 StepCode<T>  fCode,
											 Compensation fCompensation)
		throws Exception
	{
		return rLabels.jump(
			new TryFinally<>(rLabels, fCode, fCompensation).nEntry);
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Runs the compensation.
	 *
	 * @param  ePending The failure that is propagated after the compensation
	 *                  or NULL for none
	 *
	 * @throws Exception If the compensation fails
	 */
	private void compensate(Throwable ePending) throws Exception
	{
		assert !bCompensated;

		bCompensated = true;

		try
		{
			fCompensation.run();
		}
		catch (Throwable e)
		{
			if (ePending != null && ePending != e)
			{
				e.addSuppressed(ePending);
			}

			throw e;
		}
	}

	/***************************************
	 * The code of the entry label that executes the protected code from the
	 * current inner entry.
	 *
	 * @return The next step
	 *
	 * @throws Exception If the code or the compensation fails
	 */
	private TaskStep<T> enter() throws Exception
	{
		TaskStep<T> rStep;

		try
		{
			rStep = rLabels.jump(nInnerEntry);
		}
		catch (Throwable e)
		{
			compensate(e);
			throw e;
		}

		if (rStep.isReturn())
		{
			compensate(null);

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
					catch (Throwable e)
					{
						compensate(e);
						throw e;
					}

					compensate(null);

					return TaskStep.returnValue(rResult);
				});
		}
		else
		{
			int nResume = rStep.getResumeLabel();

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
