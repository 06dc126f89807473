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

import de.esoco.task.await.Awaitable;
import de.esoco.task.await.Awaiter;

import java.util.List;


/********************************************************************
 * A single-threaded awaitable for tests that is completed explicitly and
 * counts the registrations of completion callbacks.
 *
 * @author eso
 */
public class ManualAwaitable<T> implements Awaitable<T>, Awaiter<T>
{
	//~ Instance fields --------------------------------------------------------

	private boolean   bCompleted	 = false;
	private T		  rResult;
	private Exception eFailure;
	private Runnable  rCallback;
	private int		  nRegistrations = 0;

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Returns an instance that has completed already.
	 *
	 * @param  rValue The result value
	 *
	 * @return The completed awaitable
	 */
	public static <T> ManualAwaitable<T> completed(T rValue)
	{
		ManualAwaitable<T> aAwaitable = new ManualAwaitable<>();

		aAwaitable.complete(rValue);

		return aAwaitable;
	}

	/***************************************
	 * Creates a new pending instance and adds it to a list.
	 *
	 * @param  rPending The list to add the instance to
	 *
	 * @return The new awaitable
	 */
	public static <T> ManualAwaitable<T> pending(
		List<ManualAwaitable<T>> rPending)
	{
		ManualAwaitable<T> aAwaitable = new ManualAwaitable<>();

		rPending.add(aAwaitable);

		return aAwaitable;
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Completes this instance with a result.
	 *
	 * @param rValue The result
	 */
	public void complete(T rValue)
	{
		rResult    = rValue;
		bCompleted = true;
		fireCallback();
	}

	/***************************************
	 * Completes this instance with a failure.
	 *
	 * @param eError The failure
	 */
	public void fail(Exception eError)
	{
		eFailure   = eError;
		bCompleted = true;
		fireCallback();
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public Awaiter<T> getAwaiter()
	{
		return this;
	}

	/***************************************
	 * Returns the number of callback registrations.
	 *
	 * @return The registration count
	 */
	public int getRegistrationCount()
	{
		return nRegistrations;
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public T getResult() throws Exception
	{
		if (!bCompleted)
		{
			throw new IllegalStateException("Not completed");
		}

		if (eFailure != null)
		{
			throw eFailure;
		}

		return rResult;
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public boolean isCompleted()
	{
		return bCompleted;
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public void onCompleted(Runnable rCallback)
	{
		nRegistrations++;

		if (bCompleted)
		{
			rCallback.run();
		}
		else
		{
			this.rCallback = rCallback;
		}
	}

	/***************************************
	 * Invokes the registered callback, if any.
	 */
	private void fireCallback()
	{
		Runnable rRun = rCallback;

		rCallback = null;

		if (rRun != null)
		{
			rRun.run();
		}
	}
}
