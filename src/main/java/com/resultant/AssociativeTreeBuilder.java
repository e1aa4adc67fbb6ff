/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.resultant;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Folds rows, one at a time, into the nested structure described by an {@link AssociativeDescriptor}.
 * <p>
 * Each call to {@link #add(Map)} walks a {@link Slot} from the root down the descriptor's tokens, creating map and
 * list nodes as needed, and parks the row at the slot it ends on. Grouping falls out of map nodes being reused across
 * rows; nothing but the current row is held outside the tree.
 * <p>
 * Maps are {@link LinkedHashMap}s, so keys keep first-seen order. Lists are {@link ArrayList}s.
 */
@NotThreadSafe
final class AssociativeTreeBuilder {
	@NonNull
	private final AssociativeDescriptor descriptor;
	@Nullable
	private final String singleColumn;
	@NonNull
	private final List<String> walkTokens;
	@NonNull
	private final RootSlot rootSlot;

	AssociativeTreeBuilder(@NonNull AssociativeDescriptor descriptor) {
		this.descriptor = requireNonNull(descriptor);
		this.singleColumn = descriptor.getSingleColumn().orElse(null);
		this.walkTokens = descriptor.getWalkTokens();
		this.rootSlot = new RootSlot();
	}

	void add(@NonNull Map<String, Object> row) {
		requireNonNull(row);

		// Single column: key -> row, later rows replace earlier ones
		if (this.singleColumn != null) {
			mapAt(this.rootSlot, this.singleColumn).put(row.get(this.singleColumn), row);
			return;
		}

		Slot slot = this.rootSlot;

		for (int i = 0; i < this.walkTokens.size(); ++i) {
			String token = this.walkTokens.get(i);

			if (AssociativeDescriptor.WILDCARD_TOKEN.equals(token)) {
				List<Object> branch = listAt(slot, token);
				branch.add(null);
				slot = new ListSlot(branch, branch.size() - 1);
			} else if (AssociativeDescriptor.RECORD_TOKEN.equals(token)) {
				String childKey = i + 1 < this.walkTokens.size() ? this.walkTokens.get(i + 1) : null;
				Map<Object, Object> record;

				if (slot.get() == null) {
					record = new LinkedHashMap<>(row);

					// The child entry becomes a branch point for the next level
					if (childKey != null)
						record.put(childKey, null);

					slot.set(record);
				} else {
					record = mapAt(slot, token);
				}

				if (childKey != null)
					slot = new MapSlot(record, childKey);
			} else {
				slot = new MapSlot(mapAt(slot, token), row.get(token));
			}
		}

		// Leaves are written once; a later row reaching an occupied leaf leaves it alone
		if (slot.get() == null)
			slot.set(row);
	}

	@Nullable
	Object getRoot() {
		return this.rootSlot.get();
	}

	@NonNull
	AssociativeDescriptor getDescriptor() {
		return this.descriptor;
	}

	@NonNull
	@SuppressWarnings("unchecked")
	private Map<Object, Object> mapAt(@NonNull Slot slot,
																		@NonNull String token) {
		Object node = slot.get();

		if (node == null) {
			Map<Object, Object> map = new LinkedHashMap<>();
			slot.set(map);
			return map;
		}

		if (node instanceof Map)
			return (Map<Object, Object>) node;

		throw new IllegalStateException(format("Descriptor '%s' expected a map at token '%s' but found %s",
				getDescriptor(), token, node.getClass().getName()));
	}

	@NonNull
	@SuppressWarnings("unchecked")
	private List<Object> listAt(@NonNull Slot slot,
															@NonNull String token) {
		Object node = slot.get();

		if (node == null) {
			List<Object> list = new ArrayList<>();
			slot.set(list);
			return list;
		}

		if (node instanceof List)
			return (List<Object>) node;

		throw new IllegalStateException(format("Descriptor '%s' expected a list at token '%s' but found %s",
				getDescriptor(), token, node.getClass().getName()));
	}

	/**
	 * A writable position in the tree: the root, a map entry or a list element.
	 */
	private interface Slot {
		@Nullable
		Object get();

		void set(@Nullable Object value);
	}

	@NotThreadSafe
	private static final class RootSlot implements Slot {
		@Nullable
		private Object value;

		@Nullable
		@Override
		public Object get() {
			return this.value;
		}

		@Override
		public void set(@Nullable Object value) {
			this.value = value;
		}
	}

	@NotThreadSafe
	private static final class MapSlot implements Slot {
		@NonNull
		private final Map<Object, Object> map;
		@Nullable
		private final Object key;

		private MapSlot(@NonNull Map<Object, Object> map,
										@Nullable Object key) {
			this.map = requireNonNull(map);
			this.key = key;
		}

		@Nullable
		@Override
		public Object get() {
			return this.map.get(this.key);
		}

		@Override
		public void set(@Nullable Object value) {
			this.map.put(this.key, value);
		}
	}

	@NotThreadSafe
	private static final class ListSlot implements Slot {
		@NonNull
		private final List<Object> list;
		private final int index;

		private ListSlot(@NonNull List<Object> list,
										 int index) {
			this.list = requireNonNull(list);
			this.index = index;
		}

		@Nullable
		@Override
		public Object get() {
			return this.list.get(this.index);
		}

		@Override
		public void set(@Nullable Object value) {
			this.list.set(this.index, value);
		}
	}
}
