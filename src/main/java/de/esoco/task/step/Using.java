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
package de.esoco.task.step;

import de.esoco.task.LabelTable;
import de.esoco.task.StepFunction;
import de.esoco.task.TaskStep;


/********************************************************************
 * Executes a body with a resource that is closed after the body has finished,
 * either by returning or by failure. Suspensions of the body don't close the
 * resource. A NULL resource is allowed and will not be closed.
 *
 * @author eso
 */
public class Using
{
	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Private, only static use.
	 */
	private Using()
	{
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Executes a body with a resource and closes the resource afterwards.
	 *
	 * @param  rLabels   The label table of the task
	 * @param  rResource The resource or NULL for none
	 * @param  fBody     The body that receives the resource
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the body or closing the resource fails
	 */
	public static <R extends AutoCloseable, T> TaskStep<T> using(
		LabelTable					rLabels,
		R							rResource,
		StepFunction<? super R, T> fBody) throws Exception
	{
		return TryFinally.tryFinally(
			rLabels,
			() -> fBody.apply(rResource),
			() ->
			{
				if (rResource != null)
				{
					rResource.close();
				}
			});
	}
}
