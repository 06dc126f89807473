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
import de.esoco.task.LoopCondition;
import de.esoco.task.StepCode;
import de.esoco.task.TaskStep;

import static de.esoco.task.step.ControlFlow.zero;


/********************************************************************
 * A loop that executes a body as long as a condition is TRUE. The body may
 * suspend any number of times in each iteration. The condition is evaluated
 * synchronously before each iteration.
 *
 * @author eso
 */
public class WhileLoop
{
	//~ Instance fields --------------------------------------------------------

	private final LabelTable	rLabels;
	private final LoopCondition fCondition;
	private final StepCode<Void> fBody;
	private final int			nEntry;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance and installs the loop label.
	 *
	 * @param rLabels    The label table of the task
	 * @param fCondition The loop condition
	 * @param fBody      The loop body
	 */
	private WhileLoop(LabelTable	 rLabels,
					  LoopCondition  fCondition,
					  StepCode<Void> fBody)
	{
		this.rLabels    = rLabels;
		this.fCondition = fCondition;
		this.fBody	    = fBody;

		nEntry = rLabels.code(this::iterate);
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Executes a loop body while a condition is TRUE.
	 *
	 * @param  rLabels    The label table of the task
	 * @param  fCondition The loop condition
	 * @param  fBody      The loop body
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the condition or the body fails
	 */
	public static TaskStep<Void> whileLoop(LabelTable	  rLabels,
										   LoopCondition  fCondition,
										   StepCode<Void> fBody)
		throws Exception
	{
		return rLabels.jump(new WhileLoop(rLabels, fCondition, fBody).nEntry);
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Performs iterations until the body suspends or the condition becomes
	 * FALSE. Iterations that return synchronously are executed in place so
	 * that the stack depth doesn't grow with the number of iterations. A
	 * suspending iteration continues at the loop label after resuming.
	 *
	 * @return The next step
	 *
	 * @throws Exception If the condition or the body fails
	 */
	private TaskStep<Void> iterate() throws Exception
	{
		while (fCondition.test())
		{
			TaskStep<Void> rStep = fBody.execute();

			if (!rStep.isReturn())
			{
				return Combine.combine(
					rLabels,
					rStep,
					() -> rLabels.jump(nEntry));
			}
		}

		return zero();
	}
}
