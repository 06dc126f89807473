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

import de.esoco.task.await.Awaitables;
import de.esoco.task.await.Awaiter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static de.esoco.task.Tasks.RESUME_LISTENER;
import static de.esoco.task.Tasks.SUSPENSION_LISTENER;


/********************************************************************
 * Advances the steps of a task across it's suspensions and provides the task
 * result through a {@link CompletableFuture}. A driver is only created by
 * {@link Tasks#run(TaskContext, LabelTable, StepCode)} if the first step of a
 * task is an await step.
 *
 * <p>Each invocation of {@link #advance()} executes the code at the current
 * resume label up to the next step. If that step is an await the new resume
 * label is stored and {@link #advance()} is registered as the completion
 * callback of the awaiter. Only one advance is active at any time because the
 * next one is only triggered by the callback of the previous suspension. The
 * state of a driver is therefore accessed without locking. If an awaiter has
 * completed already when the callback is registered the next advance runs
 * recursively on the current stack.</p>
 *
 * @author eso
 */
public class TaskDriver<T>
{
	//~ Static fields/initializers ---------------------------------------------

	private static final Logger LOG = LoggerFactory.getLogger(TaskDriver.class);

	private static final AtomicLong aNextId = new AtomicLong(1);

	//~ Instance fields --------------------------------------------------------

	private final long				   nId     = aNextId.getAndIncrement();
	private final TaskContext		   rContext;
	private final CompletableFuture<T> fPromise = new CompletableFuture<>();

	private LabelTable  rLabels;
	private TaskStep<T> rFirstStep;
	private int		    nCurrentLabel;
	private int		    nSuspensions = 0;

	private volatile TaskState eState = TaskState.NOT_STARTED;

	private final BiConsumer<Awaiter<?>, Integer> fSuspensionListener;
	private final IntConsumer					  fResumeListener;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance.
	 *
	 * @param rContext   The task context
	 * @param rLabels    The label table of the task
	 * @param rFirstStep The first step of the task which must be an await
	 */
	TaskDriver(TaskContext rContext, LabelTable rLabels, TaskStep<T> rFirstStep)
	{
		assert rFirstStep.isAwait();

		this.rContext   = rContext;
		this.rLabels    = rLabels;
		this.rFirstStep = rFirstStep;

		nCurrentLabel	    = rFirstStep.getResumeLabel();
		fSuspensionListener = rContext.get(SUSPENSION_LISTENER);
		fResumeListener     = rContext.get(RESUME_LISTENER);
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Returns the label at which the task will resume next.
	 *
	 * @return The current resume label
	 */
	public final int getCurrentLabel()
	{
		return nCurrentLabel;
	}

	/***************************************
	 * Returns the future that receives the result of the task.
	 *
	 * @return The result future
	 */
	public final CompletableFuture<T> getPromise()
	{
		return fPromise;
	}

	/***************************************
	 * Returns the current execution state.
	 *
	 * @return The task state
	 */
	public final TaskState getState()
	{
		return eState;
	}

	/***************************************
	 * Returns the number of suspensions of the task so far.
	 *
	 * @return The suspension count
	 */
	public final int getSuspensionCount()
	{
		return nSuspensions;
	}

	/***************************************
	 * Returns the unique ID of this instance.
	 *
	 * @return The driver ID
	 */
	public final long id()
	{
		return nId;
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public String toString()
	{
		return String.format(
			"%s-%d[%s, label %d]",
			getClass().getSimpleName(),
			nId,
			eState,
			nCurrentLabel);
	}

	/***************************************
	 * Executes the task up to the next suspension or until it has finished.
	 * The first invocation processes the first step that has already been
	 * computed, all later invocations resume at the current label.
	 */
	void advance()
	{
		if (eState.isFinished())
		{
			LOG.warn("{}: advance after completion ignored", this);

			return;
		}

		eState = TaskState.RUNNING;

		try
		{
			TaskStep<T> rStep;

			if (rFirstStep != null)
			{
				rStep	   = rFirstStep;
				rFirstStep = null;
			}
			else
			{
				LOG.trace("{}: resuming", this);

				if (fResumeListener != null)
				{
					fResumeListener.accept(nCurrentLabel);
				}

				rStep = rLabels.jump(nCurrentLabel);
			}

			if (rStep.isReturn())
			{
				finish(rStep.getResult());
			}
			else if (rStep.isReturnFrom())
			{
				handOff(rStep.getNextTask());
			}
			else
			{
				suspend(rStep.getAwaiter(), rStep.getResumeLabel());
			}
		}
		catch (Throwable e)
		{
			fail(e);
		}
	}

	/***************************************
	 * Starts the execution of the task.
	 *
	 * @return The future of the task result
	 */
	CompletableFuture<T> start()
	{
		LOG.debug("{}: started", this);
		advance();

		return fPromise;
	}

	/***************************************
	 * Completes the task with an error.
	 *
	 * @param eError The error
	 */
	private void fail(Throwable eError)
	{
		if (eState.isFinished())
		{
			LOG.warn("{}: error after completion", this, eError);
		}
		else
		{
			eState  = TaskState.FAULTED;
			rLabels = null;

			LOG.debug("{}: failed with {}", this, eError.toString());
			fPromise.completeExceptionally(eError);
			Tasks.handleFailure(rContext, eError);
		}
	}

	/***************************************
	 * Completes the task with a result.
	 *
	 * @param rResult The result
	 */
	private void finish(T rResult)
	{
		eState  = TaskState.FULFILLED;
		rLabels = null;

		LOG.debug("{}: finished after {} suspensions", this, nSuspensions);
		fPromise.complete(rResult);
	}

	/***************************************
	 * Binds the task result to the result of another future.
	 *
	 * @param fNextTask The future to take the result from
	 */
	private void handOff(CompletableFuture<T> fNextTask)
	{
		eState = TaskState.SUSPENDED;

		fNextTask.whenComplete(
			(r, e) ->
			{
				if (e != null)
				{
					fail(Awaitables.unwrap(e));
				}
				else
				{
					finish(r);
				}
			});
	}

	/***************************************
	 * Suspends the task until an awaiter has completed.
	 *
	 * @param rAwaiter     The awaiter
	 * @param nResumeLabel The label to resume at
	 */
	private void suspend(Awaiter<?> rAwaiter, int nResumeLabel)
	{
		nCurrentLabel = nResumeLabel;
		eState		  = TaskState.SUSPENDED;
		nSuspensions++;

		LOG.trace("{}: suspended on {}", this, rAwaiter);

		if (fSuspensionListener != null)
		{
			fSuspensionListener.accept(rAwaiter, nResumeLabel);
		}

		rAwaiter.onCompleted(this::advance);
	}
}
