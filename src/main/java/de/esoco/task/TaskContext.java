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
import de.esoco.task.await.FutureAwaitable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;


/********************************************************************
 * The context for the execution of tasks. A context defines the executor on
 * which tasks resume after awaiting a future in a context-sensitive way and
 * holds the values of configuration options like those defined in {@link
 * Tasks}. Options may be changed concurrently with running tasks, but a task
 * driver reads the listener options only once when it is created.
 *
 * @author eso
 */
public class TaskContext
{
	//~ Instance fields --------------------------------------------------------

	private final Executor rResumeExecutor;

	private final Map<TaskOption<?>, Object> aOptions =
		new ConcurrentHashMap<>();

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance without a resume executor. Tasks in this context
	 * will resume on the thread that completes an awaited future.
	 */
	public TaskContext()
	{
		this(null);
	}

	/***************************************
	 * Creates a new instance with a specific resume executor.
	 *
	 * @param rResumeExecutor The executor to resume tasks with or NULL to
	 *                        resume on the completing thread
	 */
	public TaskContext(Executor rResumeExecutor)
	{
		this.rResumeExecutor = rResumeExecutor;
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Returns an awaitable for a future that resumes in this context.
	 *
	 * @param  fFuture The future to await
	 *
	 * @return The awaitable
	 */
	public <T> FutureAwaitable<T> awaitable(CompletableFuture<T> fFuture)
	{
		return Awaitables.of(fFuture, rResumeExecutor);
	}

	/***************************************
	 * Returns the value of an option in this context. If the option has not
	 * been set it's default value will be returned.
	 *
	 * @param  rOption The option
	 *
	 * @return The option value or the default value (may be NULL)
	 */
	@SuppressWarnings("unchecked")
	public <T> T get(TaskOption<T> rOption)
	{
		Object rValue = aOptions.get(rOption);

		return rValue != null ? (T) rValue : rOption.getDefault();
	}

	/***************************************
	 * Returns the executor that tasks resume with.
	 *
	 * @return The resume executor or NULL for none
	 */
	public final Executor getResumeExecutor()
	{
		return rResumeExecutor;
	}

	/***************************************
	 * Checks whether an option has been set explicitly in this context.
	 *
	 * @param  rOption The option
	 *
	 * @return TRUE if the option has been set
	 */
	public boolean has(TaskOption<?> rOption)
	{
		return aOptions.containsKey(rOption);
	}

	/***************************************
	 * Sets the value of an option. Setting NULL removes the option, so that
	 * the context returns the default value again.
	 *
	 * @param  rOption The option
	 * @param  rValue  The new value or NULL to remove the option
	 *
	 * @return This instance for fluent invocation
	 */
	public <T> TaskContext set(TaskOption<T> rOption, T rValue)
	{
		Objects.requireNonNull(rOption);

		if (rValue != null)
		{
			aOptions.put(rOption, rValue);
		}
		else
		{
			aOptions.remove(rOption);
		}

		return this;
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public String toString()
	{
		return String.format(
			"%s%s",
			getClass().getSimpleName(),
			aOptions.keySet());
	}
}
