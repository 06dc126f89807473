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

/********************************************************************
 * The capability to wait for the completion of an asynchronous result. An
 * awaiter is obtained from an {@link Awaitable}. All methods must be
 * non-blocking.
 *
 * @author eso
 */
public interface Awaiter<T>
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Returns the result. This method may only be invoked after the awaiter has
	 * completed. If the awaited computation has failed the original exception
	 * will be thrown.
	 *
	 * @return The result value
	 *
	 * @throws Exception The failure of the awaited computation
	 */
	public T getResult() throws Exception;

	/***************************************
	 * Checks whether the awaited computation has completed, either successfully
	 * or by failure.
	 *
	 * @return TRUE if completed
	 */
	public boolean isCompleted();

	/***************************************
	 * Registers a callback that will be invoked exactly once when the awaited
	 * computation completes. If it has completed already the callback may be
	 * invoked immediately. The thread on which the callback is invoked is
	 * determined by the implementation.
	 *
	 * @param rCallback The completion callback
	 */
	public void onCompleted(Runnable rCallback);
}
