package org.metricshub.stackflow.intermediate;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Stackflow
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Hands out the {@link Address} labels of one {@link InstructionList} and
 * tracks the ones still waiting for their position.
 */
class AddressManager {

	private final Set<Address> unresolvedAddresses = new LinkedHashSet<Address>();
	private final Map<String, Integer> labelCounts = new HashMap<String, Integer>();

	/**
	 * @param label base name; a counter is appended so that labels stay unique
	 */
	Address createAddress(String label) {
		Integer count = labelCounts.get(label);
		int next = count == null ? 0 : count + 1;
		labelCounts.put(label, next);
		Address address = new Address(label + "_" + next);
		unresolvedAddresses.add(address);
		return address;
	}

	void resolveAddress(Address address, int index) {
		if (!unresolvedAddresses.remove(address)) {
			throw new IllegalStateException(address + " is already resolved, or belongs to another instruction list");
		}
		address.assignIndex(index);
	}

	boolean hasUnresolvedAddresses() {
		return !unresolvedAddresses.isEmpty();
	}

	Set<Address> getUnresolvedAddresses() {
		return new LinkedHashSet<Address>(unresolvedAddresses);
	}
}
