/*******************************************************************************
 * PhyloTree - Phylogenetic trees and Newick processing
 * Copyright 2026 PhyloTree contributors
 *
 * This file is part of PhyloTree.
 *
 *     PhyloTree is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     PhyloTree is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with PhyloTree.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package phylotree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered collection of named trees
 * @author PhyloTree contributors
 */
public class TreeCollection<N,E> implements Iterable<Tree<N,E>> {
	private final List<String> names = new ArrayList<>();
	private final List<Tree<N,E>> trees = new ArrayList<>();
	
	/**
	 * Adds a tree at the end of the collection
	 * @param name of the tree. Names must be unique within the collection
	 * @param tree to add
	 */
	public void add(String name, Tree<N,E> tree) {
		if(name==null) throw new NullPointerException("Tree name can not be null");
		if(tree==null) throw new NullPointerException("Tree can not be null");
		if(names.contains(name)) throw new IllegalArgumentException("Duplicated tree name: "+name);
		names.add(name);
		trees.add(tree);
	}
	
	public Tree<N,E> get(int index) {
		return trees.get(index);
	}
	
	/**
	 * @param name of the tree
	 * @return Tree<N,E> tree with the given name or null if there is no tree with that name
	 */
	public Tree<N,E> get(String name) {
		int idx = names.indexOf(name);
		if(idx<0) return null;
		return trees.get(idx);
	}
	
	public String getName(int index) {
		return names.get(index);
	}
	
	public List<String> getNames() {
		return Collections.unmodifiableList(names);
	}
	
	public int size() {
		return trees.size();
	}
	
	public boolean isEmpty() {
		return trees.isEmpty();
	}
	
	public void clear() {
		names.clear();
		trees.clear();
	}

	@Override
	public Iterator<Tree<N,E>> iterator() {
		return Collections.unmodifiableList(trees).iterator();
	}
}
