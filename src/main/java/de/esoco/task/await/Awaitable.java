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
 * Interface of objects that can be awaited in a task. This is implemented by
 * {@link FutureAwaitable} for {@link java.util.concurrent.CompletableFuture}
 * and can be implemented by any other type that provides an asynchronous
 * result.
 *
 * @author eso
 */
@FunctionalInterface
public interface Awaitable<T>
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Returns an awaiter for this instance.
	 *
	 * @return The awaiter
	 */
	public Awaiter<T> getAwaiter();
}
