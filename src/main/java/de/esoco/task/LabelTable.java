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

import java.util.ArrayList;
import java.util.List;


/********************************************************************
 * The registry of the resumable code points of a task. Each label is an
 * integer index into a growable list of type-erased {@link StepCode}
 * continuations. Labels are assigned monotonically starting at zero and are
 * never reused. Code can be installed after a label has been allocated, which
 * allows forward references between the labels of a control structure.
 *
 * <p>A label table is shared by all control flow combinators of a single task
 * expression and lives as long as the {@link TaskDriver} that runs it. The
 * result type of a label is not stored because generic types are erased. It is
 * the responsibility of the combinators to jump to a label only with the type
 * it has been declared with. Violations that can be detected at runtime are
 * signaled with a {@link LabelError}.</p>
 *
 * <p>This class is not thread-safe. It is only accessed by the single step
 * that is executed by a task at any time.</p>
 *
 * @author eso
 */
public class LabelTable
{
	//~ Instance fields --------------------------------------------------------

	private final List<StepCode<?>> aLabels = new ArrayList<>();

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Allocates a new label without code. The code must be set with {@link
	 * #setCode(int, StepCode)} before the label is jumped to.
	 *
	 * @return The new label
	 */
	public int allocateLabel()
	{
		int nLabel = aLabels.size();

		aLabels.add(null);

		return nLabel;
	}

	/***************************************
	 * Allocates a new label and installs the given code for it.
	 *
	 * @param  fCode The label code
	 *
	 * @return The new label
	 */
	public <T> int code(StepCode<T> fCode)
	{
		int nLabel = allocateLabel();

		setCode(nLabel, fCode);

		return nLabel;
	}

	/***************************************
	 * Executes the code of a label and returns the resulting step. The type
	 * parameter must match the type the label code has been declared with.
	 *
	 * @param  nLabel The label to jump to
	 *
	 * @return The step returned by the label code
	 *
	 * @throws Exception  Any exception thrown by the label code
	 * @throws LabelError If the label is invalid or the code returned no step
	 */
	@SuppressWarnings("unchecked")
	public <T> TaskStep<T> jump(int nLabel) throws Exception
	{
		TaskStep<?> rStep = getCode(nLabel).execute();

		if (rStep == null)
		{
			throw new LabelError("No step returned from label " + nLabel);
		}

		return (TaskStep<T>) rStep;
	}

	/***************************************
	 * Sets or replaces the code of a label.
	 *
	 * @param nLabel The label
	 * @param fCode  The label code
	 *
	 * @throws LabelError If the label has not been allocated
	 */
	public <T> void setCode(int nLabel, StepCode<T> fCode)
	{
		checkLabel(nLabel);

		if (fCode == null)
		{
			throw new IllegalArgumentException("Label code must not be NULL");
		}

		aLabels.set(nLabel, fCode);
	}

	/***************************************
	 * Returns the number of labels that have been allocated.
	 *
	 * @return The label count
	 */
	public int size()
	{
		return aLabels.size();
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public String toString()
	{
		return String.format("%s[%d]", getClass().getSimpleName(), size());
	}

	/***************************************
	 * Checks that a label has been allocated.
	 *
	 * @param  nLabel The label to check
	 *
	 * @throws LabelError If the label is invalid
	 */
	private void checkLabel(int nLabel)
	{
		if (nLabel < 0 || nLabel >= aLabels.size())
		{
			throw new LabelError(
				String.format(
					"Undefined label %d (allocated: %d)",
					nLabel,
					aLabels.size()));
		}
	}

	/***************************************
	 * Returns the code of a label.
	 *
	 * @param  nLabel The label
	 *
	 * @return The label code
	 *
	 * @throws LabelError If the label is invalid or has no code
	 */
	private StepCode<?> getCode(int nLabel)
	{
		checkLabel(nLabel);

		StepCode<?> fCode = aLabels.get(nLabel);

		if (fCode == null)
		{
			throw new LabelError("No code for label " + nLabel);
		}

		return fCode;
	}
}
