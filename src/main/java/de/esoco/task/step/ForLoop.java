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

import java.util.Iterator;
import java.util.stream.Stream;


/********************************************************************
 * Iterates over the elements of an {@link Iterable} or a {@link Stream} and
 * executes a body for each element. The iteration is a single forward pass in
 * the order of the iterator. An element is only requested after the body for
 * the previous element has finished, including any suspensions. Iterators and
 * streams that are {@link AutoCloseable} are closed after the loop has
 * finished.
 *
 * @author eso
 */
public class ForLoop
{
	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Private, only static use.
	 */
	private ForLoop()
	{
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Executes a body for each element of an iterable.
	 *
	 * @param  rLabels   The label table of the task
	 * @param  rSequence The iterable
	 * @param  fBody     The body to execute for each element
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the iteration or the body fails
	 */
	public static <E> TaskStep<Void> forLoop(
		LabelTable						rLabels,
		Iterable<E>						rSequence,
		StepFunction<? super E, Void>	fBody) throws Exception
	{
		Iterator<E> rIterator = rSequence.iterator();

		return Using.using(
			rLabels,
			rIterator instanceof AutoCloseable ? (AutoCloseable) rIterator
											   : null,
			r -> iterate(rLabels, rIterator, fBody));
	}

	/***************************************
	 * Executes a body for each element of a stream and closes the stream
	 * afterwards.
	 *
	 * @param  rLabels The label table of the task
	 * @param  rStream The stream
	 * @param  fBody   The body to execute for each element
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the iteration or the body fails
	 */
	public static <E> TaskStep<Void> forLoop(
		LabelTable						rLabels,
		Stream<E>						rStream,
		StepFunction<? super E, Void>	fBody) throws Exception
	{
		return Using.using(
			rLabels,
			rStream,
			s -> iterate(rLabels, s.iterator(), fBody));
	}

	/***************************************
	 * Runs the while loop over an iterator.
	 *
	 * @param  rLabels   The label table of the task
	 * @param  rIterator The iterator
	 * @param  fBody     The body to execute for each element
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the iteration or the body fails
	 */
	private static <E> TaskStep<Void> iterate(
		LabelTable						rLabels,
		Iterator<E>						rIterator,
		StepFunction<? super E, Void>	fBody) throws Exception
	{
		return WhileLoop.whileLoop(
			rLabels,
			rIterator::hasNext,
			() -> fBody.apply(rIterator.next()));
	}
}
