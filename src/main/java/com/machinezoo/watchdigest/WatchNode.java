// Part of Watchdigest
package com.machinezoo.watchdigest;

/*
 * Node of the single doubly linked list that holds all watches of one ChangeDetector in digest order.
 * Plain nodes serve as group markers. Every group's run starts with its marker,
 * which gives records and child groups a stable anchor even when the group has no records yet.
 */
class WatchNode<H> {
	WatchNode<H> previous;
	WatchNode<H> next;
}
