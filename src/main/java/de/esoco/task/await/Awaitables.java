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
package de.esoco.task.await;

import de.esoco.task.TaskException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;


/********************************************************************
 * Factory methods for {@link Awaitable} instances and helpers for the handling
 * of asynchronous failures.
 *
 * @author eso
 */
public class Awaitables
{
	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Private, only static use.
	 */
	private Awaitables()
	{
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Returns an awaitable for a future that resumes on the thread that
	 * completes the future.
	 *
	 * @param  fFuture The future to await
	 *
	 * @return The awaitable
	 */
	public static <T> FutureAwaitable<T> of(CompletableFuture<T> fFuture)
	{
		return new FutureAwaitable<>(fFuture, null);
	}

	/***************************************
	 * Returns an awaitable for a future that resumes with a certain executor.
	 *
	 * @param  fFuture         The future to await
	 * @param  rResumeExecutor The executor to resume with
	 *
	 * @return The awaitable
	 */
	public static <T> FutureAwaitable<T> of(
		CompletableFuture<T> fFuture,
		Executor			 rResumeExecutor)
	{
		return new FutureAwaitable<>(fFuture, rResumeExecutor);
	}

	/***************************************
	 * Prepares the failure of an asynchronous computation for rethrowing. The
	 * original exception is unwrapped from completion and execution exceptions.
	 * If it is an {@link Error} it will be thrown directly. Throwables that are
	 * neither errors nor exceptions will be wrapped in a {@link TaskException}.
	 * The result is intended to be used as the argument of a throw statement.
	 *
	 * @param  eFailure The failure exception
	 *
	 * @return The exception to throw
	 */
	public static Exception rethrow(Throwable eFailure)
	{
		Throwable eCause = unwrap(eFailure);

		if (eCause instanceof Error)
		{
			throw (Error) eCause;
		}
		else if (eCause instanceof Exception)
		{
			return (Exception) eCause;
		}
		else
		{
			return new TaskException(eCause);
		}
	}

	/***************************************
	 * Returns the original failure from a throwable that may be wrapped in
	 * {@link CompletionException} or {@link ExecutionException} instances.
	 *
	 * @param  eFailure The failure to unwrap
	 *
	 * @return The original failure
	 */
	public static Throwable unwrap(Throwable eFailure)
	{
		Throwable eCause = eFailure;

		while ((eCause instanceof CompletionException ||
				eCause instanceof ExecutionException) &&
			   eCause.getCause() != null)
		{
			eCause = eCause.getCause();
		}

		return eCause;
	}
}
