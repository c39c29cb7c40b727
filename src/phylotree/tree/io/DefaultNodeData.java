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
package phylotree.tree.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node payload keeping the information that Newick texts store for nodes
 * @author PhyloTree contributors
 */
public class DefaultNodeData implements NewickPayload {
	
	public static final NewickPayloadFactory<DefaultNodeData> FACTORY = DefaultNodeData::new;
	
	private String name = "";
	private final List<String> comments = new ArrayList<>();
	private final List<String> tags = new ArrayList<>();
	
	public DefaultNodeData() {
		
	}
	
	public DefaultNodeData(String name) {
		setName(name);
	}
	
	public DefaultNodeData(NewickBrokerElement element) {
		setName(element.getName());
		comments.addAll(element.getComments());
		tags.addAll(element.getTags());
	}

	@Override
	public void toNewickElement(NewickBrokerElement element) {
		element.setName(name);
		for(String comment:comments) element.addComment(comment);
		for(String tag:tags) element.addTag(tag);
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		if(name==null) name = "";
		this.name = name;
	}
	
	public List<String> getComments() {
		return Collections.unmodifiableList(comments);
	}
	
	public void addComment(String comment) {
		comments.add(comment);
	}
	
	public List<String> getTags() {
		return Collections.unmodifiableList(tags);
	}
	
	public void addTag(String tag) {
		tags.add(tag);
	}

	@Override
	public String toString() {
		return name;
	}
}
