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

import de.esoco.task.await.Awaiter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;


/********************************************************************
 * The result of one unit of synchronous progress of a task. A step is either a
 * final {@link #isReturn() return value}, a {@link #isReturnFrom() hand-off}
 * to another future that provides the final result, or an {@link #isAwait()
 * await} of some {@link Awaiter} after which the execution continues at a
 * certain label of the task's {@link LabelTable}.
 *
 * <p>Steps are immutable and are created anew each time the code of a label
 * is executed. The accessor methods may only be invoked for the matching step
 * type. Invoking them for another type is a programming error that is
 * signaled with a {@link LabelError}.</p>
 *
 * @author eso
 */
public final class TaskStep<T>
{
	//~ Enums ------------------------------------------------------------------

	/********************************************************************
	 * The available step types.
	 */
	public enum StepType { RETURN, RETURN_FROM, AWAIT }

	//~ Instance fields --------------------------------------------------------

	private final StepType eType;
	private final Object   rData;
	private final int	   nResumeLabel;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Internal constructor, instances are created through the factory methods.
	 *
	 * @param eType        The step type
	 * @param rData        The step data (value, future, or awaiter)
	 * @param nResumeLabel The resume label for await steps or -1 for none
	 */
	private TaskStep(StepType eType, Object rData, int nResumeLabel)
	{
		this.eType		  = eType;
		this.rData		  = rData;
		this.nResumeLabel = nResumeLabel;
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Creates a step that suspends the execution until an awaiter has
	 * completed and then resumes at a certain label.
	 *
	 * @param  rAwaiter     The awaiter to wait for
	 * @param  nResumeLabel The label to resume the execution at
	 *
	 * @return The new step
	 */
	public static <T> TaskStep<T> await(Awaiter<?> rAwaiter, int nResumeLabel)
	{
		Objects.requireNonNull(rAwaiter);

		if (nResumeLabel < 0)
		{
			throw new IllegalArgumentException(
				"Invalid resume label: " + nResumeLabel);
		}

		return new TaskStep<>(StepType.AWAIT, rAwaiter, nResumeLabel);
	}

	/***************************************
	 * Creates a step that hands off the result of the task to another future.
	 *
	 * @param  fTask The future that provides the result
	 *
	 * @return The new step
	 */
	public static <T> TaskStep<T> returnFrom(CompletableFuture<T> fTask)
	{
		Objects.requireNonNull(fTask);

		return new TaskStep<>(StepType.RETURN_FROM, fTask, -1);
	}

	/***************************************
	 * Creates a step that returns a final value.
	 *
	 * @param  rValue The result value (may be NULL)
	 *
	 * @return The new step
	 */
	public static <T> TaskStep<T> returnValue(T rValue)
	{
		return new TaskStep<>(StepType.RETURN, rValue, -1);
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Returns the awaiter of an await step.
	 *
	 * @return The awaiter
	 */
	public Awaiter<?> getAwaiter()
	{
		checkType(StepType.AWAIT);

		return (Awaiter<?>) rData;
	}

	/***************************************
	 * Returns the future of a return-from step.
	 *
	 * @return The future that provides the result
	 */
	@SuppressWarnings("unchecked")
	public CompletableFuture<T> getNextTask()
	{
		checkType(StepType.RETURN_FROM);

		return (CompletableFuture<T>) rData;
	}

	/***************************************
	 * Returns the value of a return step.
	 *
	 * @return The result value
	 */
	@SuppressWarnings("unchecked")
	public T getResult()
	{
		checkType(StepType.RETURN);

		return (T) rData;
	}

	/***************************************
	 * Returns the label to resume the execution at after the awaiter of an
	 * await step has completed.
	 *
	 * @return The resume label
	 */
	public int getResumeLabel()
	{
		checkType(StepType.AWAIT);

		return nResumeLabel;
	}

	/***************************************
	 * Returns the type of this step.
	 *
	 * @return The step type
	 */
	public StepType getType()
	{
		return eType;
	}

	/***************************************
	 * Checks whether this is an await step.
	 *
	 * @return TRUE for an await step
	 */
	public boolean isAwait()
	{
		return eType == StepType.AWAIT;
	}

	/***************************************
	 * Checks whether this is a return step.
	 *
	 * @return TRUE for a return step
	 */
	public boolean isReturn()
	{
		return eType == StepType.RETURN;
	}

	/***************************************
	 * Checks whether this is a return-from step.
	 *
	 * @return TRUE for a return-from step
	 */
	public boolean isReturnFrom()
	{
		return eType == StepType.RETURN_FROM;
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public String toString()
	{
		return eType == StepType.AWAIT
			   ? String.format("%s[%s -> %d]", eType, rData, nResumeLabel)
			   : String.format("%s[%s]", eType, rData);
	}

	/***************************************
	 * Checks that this step has a certain type.
	 *
	 * @param  eExpected The expected type
	 *
	 * @throws LabelError If the type doesn't match
	 */
	private void checkType(StepType eExpected)
	{
		if (eType != eExpected)
		{
			throw new LabelError(
				String.format("Expected %s step but was %s", eExpected, this));
		}
	}
}
