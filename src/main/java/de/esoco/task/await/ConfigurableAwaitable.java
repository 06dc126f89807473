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
 * An {@link Awaitable} that allows to choose whether the awaiting code will
 * be resumed in the context it has been started in.
 *
 * @author eso
 */
public interface ConfigurableAwaitable<T> extends Awaitable<T>
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Returns an awaitable that either resumes in the originating context or
	 * on any thread that completes the awaited computation.
	 *
	 * @param  bContinueOnContext TRUE to resume in the originating context,
	 *                            FALSE to resume without context affinity
	 *
	 * @return The configured awaitable
	 */
	public Awaitable<T> configureAwait(boolean bContinueOnContext);
}
