package dev.zxul767.toy.runtime;

import java.util.List;

interface ToyCallable {
  int arity();
  Object call(Interpreter interpreter, List<Object> arguments);
}
