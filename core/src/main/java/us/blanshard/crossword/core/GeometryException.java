/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.core;

/**
 * Thrown when a crossword's geometry is malformed, for example a declared slot
 * that doesn't match the run of fillable cells it sits on.
 *
 * @author Luke Blanshard
 */
@SuppressWarnings("serial")
public class GeometryException extends IllegalArgumentException {

  public GeometryException(String message) {
    super(message);
  }
}
