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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static de.esoco.task.TaskOption.newDefaultOption;
import static de.esoco.task.TaskOption.newOption;


/********************************************************************
 * Contains the global task functions and configuration options. The options
 * are set on a {@link TaskContext}.
 *
 * @author eso
 */
public class Tasks
{
	//~ Static fields/initializers ---------------------------------------------

	private static final Logger LOG = LoggerFactory.getLogger(Tasks.class);

	/**
	 * Configuration: A handler for the exceptions of failed tasks. It will be
	 * invoked for every task that fails, whether the failure occurred before
	 * the first suspension or later. The failure is also available from the
	 * future of the task. The default value logs the exception with level
	 * DEBUG.
	 */
	public static final TaskOption<Consumer<Throwable>> EXCEPTION_HANDLER =
		newDefaultOption(
			"EXCEPTION_HANDLER",
			(Consumer<Throwable>) (e -> LOG.debug("Task failed", e)));

	/**
	 * Configuration: a listener for task suspensions. It will be invoked with
	 * the awaiter and the resume label each time a task suspends. This relation
	 * is intended mainly for debugging purposes.
	 */
	public static final TaskOption<BiConsumer<Awaiter<?>, Integer>> SUSPENSION_LISTENER =
		newOption("SUSPENSION_LISTENER");

	/**
	 * Configuration: a listener that is invoked with the resume label before a
	 * suspended task resumes execution. This relation is intended mainly for
	 * debugging purposes.
	 */
	public static final TaskOption<IntConsumer> RESUME_LISTENER =
		newOption("RESUME_LISTENER");

	private static TaskContext rDefaultContext = new TaskContext();

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Private, only static use.
	 */
	private Tasks()
	{
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Returns the default {@link TaskContext}.
	 *
	 * @return The default context
	 */
	public static TaskContext getDefaultContext()
	{
		return rDefaultContext;
	}

	/***************************************
	 * Runs the first step of a task and returns a future of the task result.
	 * If the first step returns a value or hands off to another future the
	 * result is returned immediately without creating a {@link TaskDriver}.
	 * This method never throws an exception. Failures are always reported
	 * through the returned future.
	 *
	 * @param  rContext The context to run the task in
	 * @param  rLabels  The label table of the task
	 * @param  fCode    The code that produces the first step
	 *
	 * @return The future of the task result
	 */
	public static <T> CompletableFuture<T> run(TaskContext rContext,
											   LabelTable  rLabels,
											   StepCode<T> fCode)
	{
		try
		{
			TaskStep<T> rFirstStep = fCode.execute();

			if (rFirstStep == null)
			{
				throw new LabelError("No first step returned");
			}
			else if (rFirstStep.isReturn())
			{
				return CompletableFuture.completedFuture(
					rFirstStep.getResult());
			}
			else if (rFirstStep.isReturnFrom())
			{
				CompletableFuture<T> fNextTask = rFirstStep.getNextTask();

				fNextTask.whenComplete(
					(r, e) ->
					{
						if (e != null)
						{
							handleFailure(rContext, Awaitables.unwrap(e));
						}
					});

				return fNextTask;
			}
			else
			{
				return new TaskDriver<>(rContext, rLabels, rFirstStep).start();
			}
		}
		catch (Throwable e)
		{
			CompletableFuture<T> fFailed = new CompletableFuture<>();

			fFailed.completeExceptionally(e);
			handleFailure(rContext, e);

			return fFailed;
		}
	}

	/***************************************
	 * Sets the default {@link TaskContext}. The context will be used for all
	 * tasks that are created without an explicit context.
	 *
	 * @param rContext The new default context
	 */
	public static void setDefaultContext(TaskContext rContext)
	{
		Objects.requireNonNull(rContext);

		rDefaultContext = rContext;
	}

	/***************************************
	 * Runs a task in the default context.
	 *
	 * @see #task(TaskContext, StepFunction)
	 */
	public static <T> CompletableFuture<T> task(
		StepFunction<TaskBuilder, T> fBody)
	{
		return task(rDefaultContext, fBody);
	}

	/***************************************
	 * Runs a task. The body function receives a new {@link TaskBuilder} that
	 * must be used to create all steps of this task.
	 *
	 * @param  rContext The context to run the task in
	 * @param  fBody    The task body
	 *
	 * @return The future of the task result
	 */
	public static <T> CompletableFuture<T> task(
		TaskContext					 rContext,
		StepFunction<TaskBuilder, T> fBody)
	{
		TaskBuilder aBuilder = new TaskBuilder(rContext);

		return aBuilder.run(() -> fBody.apply(aBuilder));
	}

	/***************************************
	 * Notifies the exception handler of a context about a task failure.
	 *
	 * @param rContext The task context
	 * @param eError   The task failure
	 */
	static void handleFailure(TaskContext rContext, Throwable eError)
	{
		Consumer<Throwable> fHandler = rContext.get(EXCEPTION_HANDLER);

		if (fHandler != null)
		{
			try
			{
				fHandler.accept(eError);
			}
			catch (RuntimeException e)
			{
				LOG.warn("Exception handler failed", e);
			}
		}
	}
}
