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

import de.esoco.task.ManualAwaitable;
import de.esoco.task.TaskStep;
import de.esoco.task.Tasks;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;


/********************************************************************
 * Test of {@link Combine}.
 *
 * @author eso
 */
public class CombineTest
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Test that a first step which returns immediately is equivalent to the
	 * rest of the code.
	 */
	@Test
	public void testCombineReturn()
	{
		List<String> aEvents = new ArrayList<>();

		CompletableFuture<String> fCombined =
			Tasks.task(
				b ->
					b.combine(
						b.zero(),
						() ->
						{
							aEvents.add("rest");

							return b.ret("R");
						}));

		CompletableFuture<String> fRest = Tasks.task(b -> b.ret("R"));

		assertTrue(fCombined.isDone());
		assertEquals(fRest.join(), fCombined.join());
		assertEquals(List.of("rest"), aEvents);
	}

	/***************************************
	 * Test that the rest is executed only after all suspensions of the first
	 * step.
	 */
	@Test
	public void testCombineSuspendedFirst()
	{
		ManualAwaitable<Integer> aFirst  = new ManualAwaitable<>();
		ManualAwaitable<Integer> aSecond = new ManualAwaitable<>();
		List<String>			 aEvents = new ArrayList<>();

		CompletableFuture<Integer> fResult =
			Tasks.task(
				b ->
					b.combine(
						b.bind(
							aFirst,
							i ->
							{
								aEvents.add("first " + i);

								return b.bind(
									aSecond,
									j ->
									{
										aEvents.add("second " + j);

										return b.zero();
									});
							}),
						() ->
						{
							aEvents.add("rest");

							return b.ret(3);
						}));

		assertFalse(fResult.isDone());
		assertTrue(aEvents.isEmpty());

		aFirst.complete(1);

		assertFalse(fResult.isDone());
		assertEquals(List.of("first 1"), aEvents);

		aSecond.complete(2);

		assertEquals(3, fResult.join());
		assertEquals(List.of("first 1", "second 2", "rest"), aEvents);
	}

	/***************************************
	 * Test of a first step that hands off to a future.
	 */
	@Test
	public void testCombineReturnFrom()
	{
		CompletableFuture<Void> fFirst = new CompletableFuture<>();

		CompletableFuture<String> fResult =
			Tasks.task(
				b -> b.combine(TaskStep.returnFrom(fFirst), () -> b.ret("R")));

		assertFalse(fResult.isDone());

		fFirst.complete(null);

		assertEquals("R", fResult.join());

		CompletableFuture<Void> fFailing = new CompletableFuture<>();

		fResult =
			Tasks.task(
				b -> b.combine(TaskStep.returnFrom(fFailing), () -> b.ret("R")));

		fFailing.completeExceptionally(new IOException("TEST"));

		CompletionException e =
			assertThrows(CompletionException.class, fResult::join);

		assertTrue(e.getCause() instanceof IOException);
	}
}
