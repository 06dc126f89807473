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

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/********************************************************************
 * Adapts a {@link CompletableFuture} to the {@link Awaitable} interface. The
 * completion callbacks of the awaiter will be dispatched to a resume executor
 * (typically that of a {@link de.esoco.task.TaskContext}) if one has been set.
 * The context-insensitive variant returned by {@link #configureAwait(boolean)
 * configureAwait(false)} invokes callbacks directly on the thread that
 * completes the future.
 *
 * @author eso
 */
public class FutureAwaitable<T> implements ConfigurableAwaitable<T>
{
	//~ Static fields/initializers ---------------------------------------------

	private static final Logger LOG =
		LoggerFactory.getLogger(FutureAwaitable.class);

	//~ Instance fields --------------------------------------------------------

	private final CompletableFuture<T> fFuture;
	private final Executor			   rResumeExecutor;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance.
	 *
	 * @param fFuture         The future to await
	 * @param rResumeExecutor The executor to resume on or NULL to resume on
	 *                        the completing thread
	 */
	public FutureAwaitable(
		CompletableFuture<T> fFuture,
		Executor			 rResumeExecutor)
	{
		Objects.requireNonNull(fFuture);

		this.fFuture		 = fFuture;
		this.rResumeExecutor = rResumeExecutor;
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public Awaitable<T> configureAwait(boolean bContinueOnContext)
	{
		return bContinueOnContext || rResumeExecutor == null
			   ? this : new FutureAwaitable<>(fFuture, null);
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public Awaiter<T> getAwaiter()
	{
		return new FutureAwaiter();
	}

	/***************************************
	 * Returns the future of this instance.
	 *
	 * @return The future
	 */
	public final CompletableFuture<T> getFuture()
	{
		return fFuture;
	}

	/***************************************
	 * Returns the resume executor.
	 *
	 * @return The resume executor or NULL for none
	 */
	public final Executor getResumeExecutor()
	{
		return rResumeExecutor;
	}

	/***************************************
	 * Hands a resume callback to an executor. If the executor rejects it the
	 * callback runs on the current thread because otherwise the awaiting task
	 * would never continue.
	 *
	 * @param rExecutor The resume executor
	 * @param rCallback The callback to run
	 */
	static void resumeWith(Executor rExecutor, Runnable rCallback)
	{
		try
		{
			rExecutor.execute(rCallback);
		}
		catch (RuntimeException e)
		{
			LOG.warn("Resume executor failed, resuming directly", e);
			rCallback.run();
		}
	}

	//~ Inner Classes ----------------------------------------------------------

	/********************************************************************
	 * The awaiter implementation for futures.
	 *
	 * @author eso
	 */
	class FutureAwaiter implements Awaiter<T>
	{
		//~ Methods ------------------------------------------------------------

		/***************************************
		 * {@inheritDoc}
		 */
		@Override
		public T getResult() throws Exception
		{
			if (!fFuture.isDone())
			{
				throw new TaskException("Future has not completed yet");
			}

			try
			{
				return fFuture.getNow(null);
			}
			catch (CompletionException | CancellationException e)
			{
				throw Awaitables.rethrow(e);
			}
		}

		/***************************************
		 * {@inheritDoc}
		 */
		@Override
		public boolean isCompleted()
		{
			return fFuture.isDone();
		}

		/***************************************
		 * {@inheritDoc}
		 */
		@Override
		public void onCompleted(Runnable rCallback)
		{
			Objects.requireNonNull(rCallback);

			fFuture.whenComplete(
				(r, e) ->
				{
					if (rResumeExecutor != null)
					{
						resumeWith(rResumeExecutor, rCallback);
					}
					else
					{
						rCallback.run();
					}
				});
		}

		/***************************************
		 * {@inheritDoc}
		 */
		@Override
		public String toString()
		{
			return String.format(
				"%s[%s]",
				getClass().getSimpleName(),
				fFuture.isDone() ? "completed" : "pending");
		}
	}
}
