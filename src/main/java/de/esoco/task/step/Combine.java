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
import de.esoco.task.TaskStep;
import de.esoco.task.await.Awaitables;
import de.esoco.task.await.Awaiter;


/********************************************************************
 * Sequences a step without a result with the code that follows it. The first
 * step may suspend any number of times. Each time it is resumed the step is
 * recomputed from its resume label until it returns, after which the rest of
 * the code is executed. Requiring the first step to have no result prevents
 * sequences of two returns.
 *
 * @author eso
 */
public class Combine<T>
{
	//~ Instance fields --------------------------------------------------------

	private final LabelTable rLabels;
	private final int		 nEntry;
	private final int		 nContinue;

	private TaskStep<Void> rFirstStep;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance and installs it's labels.
	 *
	 * @param rLabels    The label table of the task
	 * @param rFirstStep The first step
	 * @param fRest      The code to execute after the first step
	 */
	private Combine(LabelTable	   rLabels,
					TaskStep<Void> rFirstStep,
					StepCode<T>    fRest)
	{
		this.rLabels    = rLabels;
		this.rFirstStep = rFirstStep;

		nContinue = rLabels.code(fRest);
		nEntry    = rLabels.code(this::enter);
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Combines a step without result with the code that follows it.
	 *
	 * @param  rLabels    The label table of the task
	 * @param  rFirstStep The first step
	 * @param  fRest      The code to execute after the first step has returned
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the rest of the code is executed directly and fails
	 */
	public static <T> TaskStep<T> combine(LabelTable	 rLabels,
										  TaskStep<Void> rFirstStep,
										  StepCode<T>    fRest) throws Exception
	{
		return rLabels.jump(new Combine<>(rLabels, rFirstStep, fRest).nEntry);
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * The code of the entry label.
	 *
	 * @return The next step
	 *
	 * @throws Exception If executing the continuation fails
	 */
	private TaskStep<T> enter() throws Exception
	{
		if (rFirstStep.isReturn())
		{
			return rLabels.jump(nContinue);
		}
		else if (rFirstStep.isReturnFrom())
		{
			Awaiter<Void> rAwaiter =
				Awaitables.of(rFirstStep.getNextTask()).getAwaiter();

			return Bind.continueWith(
				rLabels,
				rAwaiter,
				() ->
				{
					rAwaiter.getResult();

					return rLabels.jump(nContinue);
				});
		}
		else
		{
			int nResume = rFirstStep.getResumeLabel();

			return TaskStep.await(
				rFirstStep.getAwaiter(),
				rLabels.code(
					() ->
					{
						rFirstStep = rLabels.jump(nResume);

						return rLabels.jump(nEntry);
					}));
		}
	}
}
