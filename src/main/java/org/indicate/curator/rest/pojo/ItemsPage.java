package org.indicate.curator.rest.pojo;

import java.util.Collection;

public class ItemsPage<T> {

	private final Collection<T> items;
	private final long total;

	//Default constructor for Jackson.
	public ItemsPage() {
		this.items = null;
		this.total = -1;
	}

	public ItemsPage(Collection<T> items) {
		this.items = items;
		this.total = items.size();
	}

	public Collection<T> getItems() {
		return items;
	}

	public long getTotal() {
		return total;
	}
}
